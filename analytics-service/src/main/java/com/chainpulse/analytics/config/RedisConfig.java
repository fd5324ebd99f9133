package com.chainpulse.analytics.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

@Configuration
public class RedisConfig {

	@Value("${spring.data.redis.host:localhost}")
	private String host;

	@Value("${spring.data.redis.port:6379}")
	private int port;

	@Value("${spring.data.redis.password:}")
	private String password;

	@Value("${spring.data.redis.database:0}")
	private int database;

	@Value("${spring.data.redis.connect-timeout-ms:2000}")
	private long connectionTimeoutMs;

	@Value("${spring.data.redis.command-timeout-ms:1000}")
	private long commandTimeoutMs;

	@Bean
	public RedisConnectionFactory redisConnectionFactory() {
		RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
		config.setHostName(host);
		config.setPort(port);
		config.setDatabase(database);
		if (StringUtils.isNotBlank(password)) {
			config.setPassword(password);
		}

		ClientOptions clientOptions = ClientOptions.builder()
			.socketOptions(SocketOptions.builder()
				.connectTimeout(Duration.ofMillis(connectionTimeoutMs))
				.build())
			.timeoutOptions(TimeoutOptions.builder()
				.fixedTimeout(Duration.ofMillis(commandTimeoutMs))
				.build())
			.build();

		LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
			.clientOptions(clientOptions)
			.commandTimeout(Duration.ofMillis(commandTimeoutMs))
			.build();

		return new LettuceConnectionFactory(config, clientConfig);
	}

	/**
	 * Keys and payloads are plain UTF-8 strings; payload bytes are stored exactly as produced.
	 */
	@Bean
	public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
		StringRedisSerializer serializer = new StringRedisSerializer();
		RedisTemplate<String, String> template = new RedisTemplate<>();
		template.setConnectionFactory(connectionFactory);
		template.setKeySerializer(serializer);
		template.setValueSerializer(serializer);
		template.afterPropertiesSet();
		return template;
	}
}
