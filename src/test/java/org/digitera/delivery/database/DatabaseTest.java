package org.digitera.delivery.database;

import com.zaxxer.hikari.HikariDataSource;
import org.digitera.delivery.AbstractDeliveryTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseTest extends AbstractDeliveryTest {

    @Autowired
    private DataSource dataSource;

    @Test
    void dataSourceIsHikariPool() {
        // 验证数据源是否为HikariCP实例
        assertTrue(dataSource instanceof HikariDataSource, "数据源不是HikariCP！");
        HikariDataSource hikariDataSource = (HikariDataSource) dataSource;
        assertEquals("DeliveryTestPool", hikariDataSource.getPoolName());
        assertEquals(30, hikariDataSource.getMaximumPoolSize());
    }

    @Test
    void schemaIsInitialized() throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            assertFalse(connection.isClosed());
            for (String table : new String[]{"user_account", "creator_capability", "purchase_order",
                    "order_line_item", "order_status_history", "entitlement", "download_event",
                    "download_token_marker"}) {
                try (ResultSet tables = connection.getMetaData().getTables(null, null, table, null)) {
                    assertTrue(tables.next(), "缺少表: " + table);
                }
            }
        }
    }
}
