package com.relay.keys.config;

import org.springframework.data.relational.core.dialect.AbstractDialect;
import org.springframework.data.relational.core.dialect.LimitClause;
import org.springframework.data.relational.core.dialect.LockClause;
import org.springframework.data.relational.core.sql.LockOptions;

/**
 * Spring Data JDBC 用的 SQLite 方言。
 * <p>
 * SQLite 不允许单独出现 OFFSET，只分页偏移时用 {@code LIMIT -1} 表示不限条数。
 */
public final class SqliteDialect extends AbstractDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final LimitClause LIMIT_CLAUSE = new SqliteLimitClause();
    private static final LockClause LOCK_CLAUSE = new NoLockClause();

    private SqliteDialect() {
    }

    @Override
    public LimitClause limit() {
        return LIMIT_CLAUSE;
    }

    @Override
    public LockClause lock() {
        return LOCK_CLAUSE;
    }

    private static final class SqliteLimitClause implements LimitClause {

        @Override
        public String getLimit(long limit) {
            return getLimitOffset(limit, 0);
        }

        @Override
        public String getOffset(long offset) {
            return getLimitOffset(-1, offset);
        }

        @Override
        public String getLimitOffset(long limit, long offset) {
            return offset > 0 ? "LIMIT " + limit + " OFFSET " + offset : "LIMIT " + limit;
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    }

    /** SQLite 没有 SELECT ... FOR UPDATE，写操作由库级锁串行化 */
    private static final class NoLockClause implements LockClause {

        @Override
        public String getLock(LockOptions lockOptions) {
            return "";
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    }
}
