package com.aisignal.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.type.JdbcType;

import java.sql.Connection;

/**
 * Shared factory for the article and subscriber mappers. Sessions run on a connection the DAO
 * already owns, so commit and close stay with the caller.
 */
public final class MyBatisSupport {
    private static final int STATEMENT_TIMEOUT_SEC = 30;
    private static final SqlSessionFactory FACTORY = new SqlSessionFactoryBuilder().build(mapperConfiguration());

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    static Configuration mapperConfiguration() {
        Configuration configuration = new Configuration();
        configuration.setMapUnderscoreToCamelCase(true);
        // digest_log.error and article.author are nullable text
        configuration.setJdbcTypeForNull(JdbcType.NULL);
        configuration.setDefaultStatementTimeout(STATEMENT_TIMEOUT_SEC);
        configuration.addMapper(ArticleMapper.class);
        configuration.addMapper(SubscriberMapper.class);
        return configuration;
    }
}
