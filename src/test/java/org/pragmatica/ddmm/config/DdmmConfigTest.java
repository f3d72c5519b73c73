package org.pragmatica.ddmm.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class DdmmConfigTest {

    @Test
    void defaults_comeFromReferenceConf() {
        var config = DdmmConfig.DEFAULT;

        assertEquals(".ddmm", config.sourceExtension());
        assertEquals(".py", config.targetExtension());
        assertEquals("__ddmmcache__", config.cacheDirectory());
        assertEquals("<string>", config.displayName());
        assertThat(config.interpreterCommand()).containsExactly("python3");
    }

    @Test
    void from_overridesSomeKeys_restFallBack() {
        var config = DdmmConfig.from(ConfigFactory.parseString("""
                                                               ddmm.target-extension = ".pyw"
                                                               ddmm.interpreter.command = ["python3.12", "-X", "utf8"]
                                                               """));

        assertEquals(".pyw", config.targetExtension());
        assertEquals(".ddmm", config.sourceExtension());
        assertThat(config.interpreterCommand()).containsExactly("python3.12", "-X", "utf8");
    }

    @Test
    void targetName_swapsExtension() {
        assertEquals("mod.py", DdmmConfig.DEFAULT.targetName("mod.ddmm"));
        assertEquals("notes.txt.py", DdmmConfig.DEFAULT.targetName("notes.txt"));
        assertEquals("mod.ddmm", DdmmConfig.DEFAULT.sourceName("mod.py"));
    }

    @Test
    void invalidValues_rejected() {
        assertThatThrownBy(() -> new DdmmConfig("ddmm", ".py", "c", "n", List.of("python3")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DdmmConfig(".py", ".py", "c", "n", List.of("python3")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must differ");
        assertThatThrownBy(() -> new DdmmConfig(".ddmm", ".py", "c", "n", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
