package com.example.musicrecommend.infrastructure.persistence.mapper;

import com.example.musicrecommend.infrastructure.persistence.entity.ListeningHistoryEntity;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ListeningHistoryMapper {

    /**
     * History rows of one listener, most listened first. A track may appear
     * on several rows; callers sum the minutes.
     */
    @Select("SELECT id, listener_id, track_id, minutes_listened, updated_at "
            + "FROM listening_history "
            + "WHERE listener_id = #{listenerId} "
            + "ORDER BY minutes_listened DESC, id ASC")
    List<ListeningHistoryEntity> selectByListener(@Param("listenerId") String listenerId);
}
