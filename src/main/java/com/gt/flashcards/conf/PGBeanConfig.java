package com.gt.flashcards.conf;

import com.gt.flashcards.card.CardDao;
import com.gt.flashcards.card.impl.CardDaoPG;
import com.gt.flashcards.serialization.ReviewDateCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${flashcards.datasource.postgres.url}") String url,
                                    @Value("${flashcards.datasource.postgres.username}") String username,
                                    @Value("${flashcards.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public CardDao getCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, Clock scheduleClock) {
        return new CardDaoPG(namedParameterJdbcTemplate, new ReviewDateCodec(scheduleClock.getZone()));
    }
}
