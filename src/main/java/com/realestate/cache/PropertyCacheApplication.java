package com.realestate.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 房产数据多级缓存引擎启动类
 */
@SpringBootApplication
@EnableScheduling
public class PropertyCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyCacheApplication.class, args);
    }
}
