package com.example.connectionmonitor.service.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorSanitizer Tests")
class ErrorSanitizerTest {

    @Test
    @DisplayName("Should redact password-like pairs")
    void shouldRedactPasswords() {
        // Given
        var text = "Login failed: Server=db01;User=sa;Password=hunter2;Database=app";

        // When
        var sanitized = ErrorSanitizer.sanitize(text);

        // Then
        assertThat(sanitized).doesNotContain("hunter2");
        assertThat(sanitized).contains("password=***");
        assertThat(sanitized).contains("Database=app");
    }

    @Test
    @DisplayName("Should redact pwd and pass variants case-insensitively")
    void shouldRedactVariants() {
        assertThat(ErrorSanitizer.sanitize("PWD=abc&x=1")).isEqualTo("password=***&x=1");
        assertThat(ErrorSanitizer.sanitize("pass=abc;x=1")).isEqualTo("password=***;x=1");
    }

    @Test
    @DisplayName("Should redact a password containing spaces up to the next separator")
    void shouldRedactSpacedPassword() {
        // When
        var sanitized = ErrorSanitizer.sanitize("Login failed: Server=db01;Password=my secret phrase;Database=app");

        // Then
        assertThat(sanitized).isEqualTo("Login failed: Server=db01;password=***;Database=app");
    }

    @Test
    @DisplayName("Should redact a braced password as a whole")
    void shouldRedactBracedPassword() {
        // When
        var sanitized = ErrorSanitizer.sanitize("jdbc:sqlserver://db01;user=sa;password={correct horse; battery};encrypt=true");

        // Then
        assertThat(sanitized).doesNotContain("correct").doesNotContain("horse").doesNotContain("battery");
        assertThat(sanitized).isEqualTo("jdbc:sqlserver://db01;user=sa;password=***;encrypt=true");
    }

    @Test
    @DisplayName("Should redact pairs with spaces around the equals sign")
    void shouldRedactSpacedAssignment() {
        assertThat(ErrorSanitizer.sanitize("Password = x")).isEqualTo("password=***");
        assertThat(ErrorSanitizer.sanitize("api_key = sk live 42&page=2")).isEqualTo("apikey=***&page=2");
    }

    @Test
    @DisplayName("Should be stable when applied to already sanitized text")
    void shouldBeIdempotent() {
        // Given
        var once = ErrorSanitizer.sanitize("user=sa;password=hunter 2;apikey=abc");

        // When
        var twice = ErrorSanitizer.sanitize(once);

        // Then
        assertThat(twice).isEqualTo(once).isEqualTo("user=sa;password=***;apikey=***");
    }

    @Test
    @DisplayName("Should redact API keys")
    void shouldRedactApiKeys() {
        // When
        var sanitized = ErrorSanitizer.sanitize("GET https://api.example.com/v1?api_key=sk-123&page=2 failed");

        // Then
        assertThat(sanitized).doesNotContain("sk-123");
        assertThat(sanitized).contains("apikey=***&page=2");
    }

    @Test
    @DisplayName("Should leave clean text and null alone")
    void shouldLeaveCleanText() {
        assertThat(ErrorSanitizer.sanitize("Connection refused")).isEqualTo("Connection refused");
        assertThat(ErrorSanitizer.sanitize(null)).isNull();
        assertThat(ErrorSanitizer.sanitize("")).isEmpty();
    }
}
