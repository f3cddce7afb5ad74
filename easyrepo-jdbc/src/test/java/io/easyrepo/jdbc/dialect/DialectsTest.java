package io.easyrepo.jdbc.dialect;

import io.easyrepo.jdbc.spi.Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectsTest {

    @Test
    void allReturnsBuiltInDialects() {
        List<Dialect> dialects = Dialects.all();

        assertTrue(dialects.size() >= 3);
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("mysql")));
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertEquals("mysql", Dialects.get("MySQL").name());
        assertEquals("postgresql", Dialects.get("POSTGRESQL").name());
        assertEquals("h2", Dialects.get("H2").name());
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Dialects.get("oracle"));
        assertTrue(ex.getMessage().contains("Unknown dialect"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost:3306/mydb").name());
        assertEquals("mysql", Dialects.detect("jdbc:mariadb://localhost:3306/mydb").name());
        assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost:5432/mydb").name());
        assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
    }

    @Test
    void detectThrowsForUnknownOrEmptyUrl() {
        assertThrows(IllegalArgumentException.class, () -> Dialects.detect("jdbc:oracle:thin:@localhost"));
        assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
        assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
    }

    @Test
    void detectFromDataSource() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:dialects_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        assertEquals("h2", Dialects.detect(dataSource).name());
    }

    @Test
    void detectWrapsConnectionFailure() {
        assertThrows(IllegalStateException.class, () -> Dialects.detect(() -> {
            throw new SQLException("down");
        }));
    }
}
