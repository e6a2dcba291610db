package com.example.musicrecommend.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackEntity {

    private Long id;

    private String title;

    private String artist;

    private String language;

    /**
     * Comma separated, in display order.
     */
    private String tags;

    private Long likes;

    private Long views;

    private Integer isDeleted;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
