package com.plot.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatabaseUrl 连接串解析")
class DatabaseUrlTest {

    @Test
    @DisplayName("默认连接串转换为 JDBC URL 并拆出用户名密码")
    void parsesDefaultPostgresUrl() {
        DatabaseUrl url = DatabaseUrl.parse("postgresql://app:pass@db:5432/appdb");

        assertThat(url.getJdbcUrl()).isEqualTo("jdbc:postgresql://db:5432/appdb");
        assertThat(url.getUsername()).isEqualTo("app");
        assertThat(url.getPassword()).isEqualTo("pass");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "postgres://app:pass@db:5432/appdb",
            "postgresql+psycopg2://app:pass@db:5432/appdb"
    })
    @DisplayName("postgres 别名与带驱动后缀的写法同样支持")
    void acceptsSchemeVariants(String raw) {
        DatabaseUrl url = DatabaseUrl.parse(raw);

        assertThat(url.getJdbcUrl()).isEqualTo("jdbc:postgresql://db:5432/appdb");
        assertThat(url.getUsername()).isEqualTo("app");
    }

    @Test
    @DisplayName("查询参数保留，日志描述中去掉")
    void keepsQueryParameters() {
        DatabaseUrl url = DatabaseUrl.parse("postgresql://app:pass@db/appdb?sslmode=require");

        assertThat(url.getJdbcUrl()).isEqualTo("jdbc:postgresql://db/appdb?sslmode=require");
        assertThat(url.describe()).isEqualTo("jdbc:postgresql://db/appdb");
    }

    @Test
    @DisplayName("密码中的转义字符会被解码")
    void decodesEscapedPassword() {
        DatabaseUrl url = DatabaseUrl.parse("postgresql://app:p%40ss@db:5432/appdb");

        assertThat(url.getPassword()).isEqualTo("p@ss");
    }

    @Test
    @DisplayName("用户名中转义的冒号不作为分隔符")
    void escapedColonInUsername() {
        DatabaseUrl url = DatabaseUrl.parse("postgresql://us%3Aer:p%3Ass@db:5432/appdb");

        assertThat(url.getUsername()).isEqualTo("us:er");
        assertThat(url.getPassword()).isEqualTo("p:ss");
    }

    @Test
    @DisplayName("JDBC URL 原样使用，不带凭据")
    void passesJdbcUrlThrough() {
        DatabaseUrl url = DatabaseUrl.parse("jdbc:h2:mem:plots;MODE=PostgreSQL");

        assertThat(url.getJdbcUrl()).isEqualTo("jdbc:h2:mem:plots;MODE=PostgreSQL");
        assertThat(url.getUsername()).isNull();
        assertThat(url.getPassword()).isNull();
    }

    @Test
    @DisplayName("只有用户名没有密码")
    void userWithoutPassword() {
        DatabaseUrl url = DatabaseUrl.parse("postgresql://app@localhost/appdb");

        assertThat(url.getUsername()).isEqualTo("app");
        assertThat(url.getPassword()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "mysql://app:pass@db/appdb", "not a url"})
    @DisplayName("空串、不支持的类型和格式错误均拒绝")
    void rejectsInvalidUrls(String raw) {
        assertThatThrownBy(() -> DatabaseUrl.parse(raw))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
