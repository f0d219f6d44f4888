/*
 * どこで: Grading インフラ設定
 * 何を: リプレイ判定で利用する StringRedisTemplate を提供する
 * なぜ: 複数レプリカ間で同じリプレイ判定ストアを共有するため
 */
package com.example.grading.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "grading.replay.store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
