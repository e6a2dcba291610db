package com.example.musicrecommend.infrastructure.persistence.mapper;

import com.example.musicrecommend.infrastructure.persistence.entity.TrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackMapper {

    /**
     * Whole live catalog in id order. Counters are read as they are at query time.
     */
    @Select("SELECT id, title, artist, language, tags, likes, views, is_deleted, created_at, updated_at "
            + "FROM track WHERE is_deleted = 0 ORDER BY id")
    List<TrackEntity> selectAllActive();
}
