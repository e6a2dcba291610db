package com.example.musicrecommend.infrastructure.persistence.mapper;

import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LikedTrackMapper {

    @Select("SELECT track_id FROM liked_track WHERE listener_id = #{listenerId}")
    List<Long> selectTrackIdsByListener(@Param("listenerId") String listenerId);
}
