package com.example.musicrecommend.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ListenerMapper {

    @Select("SELECT last_track_id FROM listener WHERE id = #{listenerId}")
    Long selectLastTrackId(@Param("listenerId") String listenerId);
}
