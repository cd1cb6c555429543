package com.taskboard.servicebackend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.ActiveProfiles;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@SpringBootTest
@ActiveProfiles("test")
class SchemaInitializationTest {

    @Autowired DataSource dataSource;
    @Autowired JdbcTemplate jdbcTemplate;

    @Test
    void schemaScriptCanRunAgainOnAnExistingDatabase() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
        populator.setContinueOnError(false);

        assertThatCode(() -> populator.execute(dataSource)).doesNotThrowAnyException();

        Integer tables = jdbcTemplate.queryForObject(
                "select count(*) from information_schema.tables where lower(table_name) in ('users', 'tasks')",
                Integer.class);
        assertThat(tables).isEqualTo(2);
    }
}
