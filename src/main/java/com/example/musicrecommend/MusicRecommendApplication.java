package com.example.musicrecommend;

import com.example.musicrecommend.common.config.AppRecommendProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.musicrecommend.infrastructure.persistence.mapper")
@EnableConfigurationProperties(AppRecommendProperties.class)
public class MusicRecommendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicRecommendApplication.class, args);
    }
}
