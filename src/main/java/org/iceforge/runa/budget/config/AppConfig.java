package org.iceforge.runa.budget.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AppConfig {

    /**
     * JSON mapper for the HTTP codecs. Declared explicitly because the YAML mapper below would
     * otherwise replace Boot's auto-configured one.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    @Bean
    public JdbcTemplate analyticsJdbcTemplate(DataSource dataSource, AnalyticsProperties props) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(props.getQueryTimeoutSeconds());
        jdbc.setMaxRows(props.getMaxRows());
        return jdbc;
    }
}
