package com.edgewatch.service.storage.impl;

import com.edgewatch.service.core.alert.AlertChannelDirectory;
import com.edgewatch.telemetry.model.AlertChannelConfig;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reads per-cluster notification targets from {@code alert_configs}. */
@Repository
public class JdbcAlertChannelDirectory implements AlertChannelDirectory {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcAlertChannelDirectory(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<AlertChannelConfig> findByClusterId(String clusterId) {
        List<AlertChannelConfig> rows = jdbc.query(
                """
                select cluster_id, channel_target
                  from alert_configs
                 where cluster_id = :cluster_id
                   and channel_target is not null
                   and channel_target <> ''
                """,
                new MapSqlParameterSource("cluster_id", clusterId),
                (rs, rowNum) -> new AlertChannelConfig(rs.getString("cluster_id"), rs.getString("channel_target")));
        return rows.stream().findFirst();
    }
}
