package com.relay.keys.repository;

import com.relay.keys.entity.ApiKeyEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface ApiKeyRepository extends CrudRepository<ApiKeyEntity, Long> {

    Optional<ApiKeyEntity> findByApiKey(String apiKey);

    boolean existsByApiKey(String apiKey);

    @Query("SELECT * FROM t_ai_apikey WHERE api_key = :apiKey AND active = 1")
    Optional<ApiKeyEntity> findActiveByApiKey(String apiKey);

    /** 同名多条时取最早创建的一条 */
    @Query("SELECT * FROM t_ai_apikey WHERE name = :name ORDER BY id LIMIT 1")
    Optional<ApiKeyEntity> findFirstByName(String name);

    @Query("SELECT * FROM t_ai_apikey ORDER BY id")
    List<ApiKeyEntity> findAllInCreationOrder();

    @Modifying
    @Query("UPDATE t_ai_apikey SET active = :active WHERE api_key = :apiKey")
    int updateActive(String apiKey, boolean active);

    /** 在数据库侧自增 */
    @Modifying
    @Query("UPDATE t_ai_apikey SET usage_count = usage_count + 1 WHERE api_key = :apiKey")
    int incrementUsage(String apiKey);

    @Modifying
    @Query("UPDATE t_ai_apikey SET active = 0 WHERE name = :name AND active = 1")
    int deactivateByName(String name);

    @Modifying
    @Query("DELETE FROM t_ai_apikey WHERE api_key = :token OR name = :token")
    int deleteByKeyOrName(String token);

    @Modifying
    @Query("UPDATE t_ai_apikey SET active = 0 WHERE active = 1 AND expires_at <= :now")
    int deactivateExpired(long now);
}
