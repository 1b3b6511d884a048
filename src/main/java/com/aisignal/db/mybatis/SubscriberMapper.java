package com.aisignal.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * Annotation SQL for {@code subscriber} and {@code digest_log}.
 */
public interface SubscriberMapper {
    @Insert("INSERT INTO subscriber(email, name, active, categories_json, min_relevance, created_at) " +
            "VALUES(#{email}, #{name}, TRUE, #{categoriesJson}, #{minRelevance}, now()) " +
            "ON CONFLICT(email) DO NOTHING")
    int insertIfAbsent(
            @Param("email") String email,
            @Param("name") String name,
            @Param("categoriesJson") String categoriesJson,
            @Param("minRelevance") int minRelevance
    );

    @Select("SELECT id, email, name, active, categories_json, min_relevance, created_at " +
            "FROM subscriber WHERE email = #{email}")
    SubscriberRow findByEmail(@Param("email") String email);

    @Select("SELECT id, email, name, active, categories_json, min_relevance, created_at " +
            "FROM subscriber WHERE active ORDER BY id")
    List<SubscriberRow> listActive();

    @Select("SELECT id, email, name, active, categories_json, min_relevance, created_at " +
            "FROM subscriber ORDER BY id")
    List<SubscriberRow> listAll();

    @Update("UPDATE subscriber SET active = FALSE WHERE email = #{email} AND active")
    int deactivate(@Param("email") String email);

    @Insert("INSERT INTO digest_log(sent_at, recipient_email, article_count, status, error) " +
            "VALUES(now(), #{email}, #{articleCount}, #{status}, #{error})")
    int insertDigestLog(
            @Param("email") String email,
            @Param("articleCount") int articleCount,
            @Param("status") String status,
            @Param("error") String error
    );
}
