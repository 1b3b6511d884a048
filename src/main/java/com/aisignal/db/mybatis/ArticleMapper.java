package com.aisignal.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * Annotation SQL for the {@code article} table; unqualified names resolve through the search path.
 */
public interface ArticleMapper {
    String COLUMNS = "id, title, url, source, published_at, body_text, author, tags_json, rank_score, " +
            "summary, category, relevance_score, is_product_or_tool AS product_or_tool, product_name, " +
            "competitors_json, competitive_advantage, fetched_at";

    @Insert("INSERT INTO article(id, title, url, source, published_at, body_text, author, tags_json, rank_score, " +
            "summary, category, relevance_score, is_product_or_tool, product_name, competitors_json, " +
            "competitive_advantage, fetched_at, updated_at) " +
            "VALUES(#{id}, #{title}, #{url}, #{source}, #{publishedAt}, #{bodyText}, #{author}, #{tagsJson}, " +
            "#{rankScore}, #{summary}, #{category}, #{relevanceScore}, #{productOrTool}, #{productName}, " +
            "#{competitorsJson}, #{competitiveAdvantage}, now(), now()) " +
            "ON CONFLICT(id) DO UPDATE SET " +
            "body_text=CASE WHEN length(excluded.body_text) > length(COALESCE(article.body_text, '')) " +
            "THEN excluded.body_text ELSE article.body_text END, " +
            "tags_json=excluded.tags_json, " +
            "rank_score=GREATEST(article.rank_score, excluded.rank_score), " +
            "summary=excluded.summary, " +
            "category=excluded.category, " +
            "relevance_score=excluded.relevance_score, " +
            "is_product_or_tool=excluded.is_product_or_tool, " +
            "product_name=excluded.product_name, " +
            "competitors_json=excluded.competitors_json, " +
            "competitive_advantage=excluded.competitive_advantage, " +
            "fetched_at=excluded.fetched_at, " +
            "updated_at=now()")
    int upsertArticle(ArticleRow row);

    @Select("SELECT " + COLUMNS + " FROM article WHERE relevance_score >= #{minRelevance} " +
            "ORDER BY relevance_score DESC, rank_score DESC, published_at DESC NULLS LAST LIMIT #{limit}")
    List<ArticleRow> queryTop(@Param("minRelevance") int minRelevance, @Param("limit") int limit);

    @Select({
            "<script>",
            "SELECT " + COLUMNS + " FROM article",
            "<where>",
            "<if test='category != null and category != \"\"'>",
            "AND category = #{category}",
            "</if>",
            "<if test='source != null and source != \"\"'>",
            "AND source ILIKE '%' || #{source} || '%'",
            "</if>",
            "<if test='minRelevance &gt; 0'>",
            "AND relevance_score &gt;= #{minRelevance}",
            "</if>",
            "<if test='search != null and search != \"\"'>",
            "AND (title ILIKE '%' || #{search} || '%' OR summary ILIKE '%' || #{search} || '%')",
            "</if>",
            "</where>",
            "ORDER BY relevance_score DESC, fetched_at DESC",
            "LIMIT #{limit} OFFSET #{offset}",
            "</script>"
    })
    List<ArticleRow> listArticles(
            @Param("category") String category,
            @Param("source") String source,
            @Param("minRelevance") int minRelevance,
            @Param("search") String search,
            @Param("limit") int limit,
            @Param("offset") int offset
    );

    @Select("SELECT COUNT(*) FROM article")
    int countAll();

    @Select("SELECT COUNT(*) FROM article WHERE is_product_or_tool")
    int countProducts();

    @Select("SELECT category, COUNT(*) AS total FROM article GROUP BY category ORDER BY total DESC, category")
    List<CategoryCountRow> countByCategory();
}
