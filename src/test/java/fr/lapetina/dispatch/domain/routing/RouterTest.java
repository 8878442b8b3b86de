package fr.lapetina.dispatch.domain.routing;

import fr.lapetina.dispatch.domain.model.Lane;
import fr.lapetina.dispatch.domain.model.SecurityVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RouterTest {

    @ParameterizedTest(name = "{1} {0} -> {2}")
    @CsvSource({
            "/static/img.png, GET, CACHE_L2",
            "/static/app.js, POST, CACHE_L2",
            "/orders, POST, CORE_WRITE",
            "/orders, PUT, CORE_WRITE",
            "/orders, PATCH, CORE_WRITE",
            "/orders, GET, CORE_READ",
            "/orders, DELETE, CORE_READ",
            "/staticfile, GET, CORE_READ"
    })
    @DisplayName("should pick the lane from path prefix and method")
    void shouldPickLane(String path, String method, Lane expected) {
        assertThat(Router.pickLane(path, method)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should label lanes as tier/mode")
    void shouldLabelLanes() {
        assertThat(Lane.CACHE_L2.label()).isEqualTo("cache/l2");
        assertThat(Lane.CORE_WRITE.label()).isEqualTo("core/write");
        assertThat(Lane.CORE_READ.label()).isEqualTo("core/read");
    }

    @Test
    @DisplayName("should map each hint bit to its verdict flag")
    void shouldMapHintBits() {
        assertThat(Router.security(0)).isEqualTo(SecurityVerdict.CLEAN);
        assertThat(Router.security(0x1)).isEqualTo(new SecurityVerdict(false, true, false));
        assertThat(Router.security(0x2)).isEqualTo(new SecurityVerdict(true, false, false));
        assertThat(Router.security(0x4)).isEqualTo(new SecurityVerdict(false, false, true));
        assertThat(Router.security(0x7)).isEqualTo(new SecurityVerdict(true, true, true));
    }

    @Test
    @DisplayName("should ignore unknown hint bits")
    void shouldIgnoreUnknownBits() {
        assertThat(Router.security(0xFFFFFFF8)).isEqualTo(SecurityVerdict.CLEAN);
    }
}
