package com.work.escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：对外提供 job/milestone 的对账、批准、领取、取消接口。
 */
@SpringBootApplication
@EnableScheduling
public class EscrowReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowReconcilerApplication.class, args);
    }
}
