package io.ezvis.proxylog.config;

import com.clickhouse.jdbc.ClickHouseDataSource;
import java.sql.SQLException;
import java.util.Properties;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Swaps the pooled {@code spring.datasource} for a ClickHouse one, so the shared {@code JdbcTemplate} and the
 * {@code RequestStore} behind it write to and read from ClickHouse.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "ezvis.store", name = "dialect", havingValue = "clickhouse")
public class ClickHouseConfig {

    @Bean
    public DataSource clickHouseDataSource(ClickHouseProperties properties) {
        if (!StringUtils.hasText(properties.getUrl())) {
            throw new IllegalStateException(
                    "ezvis.clickhouse.url must be set when ezvis.store.dialect=clickhouse");
        }
        try {
            DataSource dataSource = new ClickHouseDataSource(properties.getUrl(), connectionProperties(properties));
            log.info("Request store backed by ClickHouse at {}", properties.getUrl());
            return dataSource;
        } catch (SQLException e) {
            throw new IllegalStateException("Invalid ClickHouse url " + properties.getUrl(), e);
        }
    }

    static Properties connectionProperties(ClickHouseProperties properties) {
        Properties connection = new Properties();
        connection.setProperty("user", properties.getUser());
        connection.setProperty("password", properties.getPassword());
        connection.setProperty("connect_timeout", Integer.toString(properties.getConnectTimeoutMs()));
        connection.setProperty("socket_timeout", Integer.toString(properties.getSocketTimeoutMs()));
        return connection;
    }
}
