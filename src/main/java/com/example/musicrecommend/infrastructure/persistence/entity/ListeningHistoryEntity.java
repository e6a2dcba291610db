package com.example.musicrecommend.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ListeningHistoryEntity {

    private Long id;

    private String listenerId;

    private Long trackId;

    private Double minutesListened;

    private LocalDateTime updatedAt;
}
