package com.libragraph.passhash.core.policy;

import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.api.UnknownSchemeException;
import com.libragraph.passhash.handlers.crypt.ShaCryptHandlerFactory;
import com.libragraph.passhash.handlers.pbkdf2.Pbkdf2HandlerFactory;
import com.libragraph.passhash.handlers.registry.HandlerRegistry;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PolicyTest {

    private static final String SAMPLE = """
            [passhash]
            # schemes tried in this order
            schemes = sha512_crypt, pbkdf2_sha256, pbkdf2_sha1
            default = sha512_crypt
            deprecated = pbkdf2_sha1
            all.vary_rounds = 10%
            sha512_crypt.min_rounds = 5000
            sha512_crypt.default_rounds = 20000
            admin.sha512_crypt.default_rounds = 40000
            admin.default_rounds = 30000
            pbkdf2_sha256.default_rounds = 2000
            """;

    @Test
    void shouldReadIniText() {
        Policy policy = Policy.fromString(SAMPLE);

        assertThat(policy.schemes()).containsExactly("sha512_crypt", "pbkdf2_sha256", "pbkdf2_sha1");
        assertThat(policy.defaultScheme()).contains("sha512_crypt");
        assertThat(policy.deprecated()).containsExactly("pbkdf2_sha1");
        assertThat(policy.hasSchemes()).isTrue();
        assertThat(policy.handlerIsDeprecated("pbkdf2_sha1")).isTrue();
        assertThat(policy.handlerIsDeprecated("sha512_crypt")).isFalse();
    }

    @Test
    void shouldResolveSchemeOverCategoryOverAll() {
        Policy policy = Policy.of(Map.of(
                "all.default_rounds", 1000,
                "all.vary_rounds", "5%",
                "admin.default_rounds", 2000,
                "sha512_crypt.default_rounds", 3000));

        assertThat(policy.getOptions("sha512_crypt", "admin").defaultRounds()).isEqualTo(3000);
        assertThat(policy.getOptions("pbkdf2_sha1", "admin").defaultRounds()).isEqualTo(2000);
        assertThat(policy.getOptions("pbkdf2_sha1").defaultRounds()).isEqualTo(1000);
        assertThat(policy.getOptions("pbkdf2_sha1").varyRounds()).isEqualTo(new VaryRounds(5, true));
        assertThat(policy.getOptions("pbkdf2_sha1").minRounds()).isNull();
    }

    @Test
    void shouldPreferCategorySchemeScope() {
        Policy policy = Policy.fromString(SAMPLE);

        assertThat(policy.getOptions("sha512_crypt", "admin").defaultRounds()).isEqualTo(40000);
        assertThat(policy.getOptions("sha512_crypt").defaultRounds()).isEqualTo(20000);
        assertThat(policy.getOptions("pbkdf2_sha256", "admin").defaultRounds()).isEqualTo(2000);
        assertThat(policy.getOptions("pbkdf2_sha1", "admin").defaultRounds()).isEqualTo(30000);
        assertThat(policy.getOptions("pbkdf2_sha1", "admin").varyRounds()).isEqualTo(new VaryRounds(10, true));
    }

    @Test
    void shouldReturnEmptyOptionsWhenNothingApplies() {
        assertThat(Policy.empty().getOptions("sha512_crypt").isEmpty()).isTrue();
        assertThat(Policy.empty().hasSchemes()).isFalse();
    }

    @Test
    void shouldAcceptDoubleUnderscoreKeys() {
        Policy dotted = Policy.of(Map.of("sha512_crypt.min_rounds", 5000));
        Policy underscored = Policy.of(Map.of("sha512_crypt__min_rounds", "5000"));

        assertThat(underscored).isEqualTo(dotted);
        assertThat(underscored.toMap()).containsEntry("sha512_crypt.min_rounds", 5000);
    }

    @Test
    void shouldRejectUnknownKeysAndBadValues() {
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.of(Map.of("sha512_crypt.colour", 1)));
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.of(Map.of("nonsense", 1)));
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.of(Map.of("all.min_rounds", "lots")));
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.of(Map.of("all.vary_rounds", "150%")));
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.of(Map.of("schemes", "a, b, a")));
    }

    @Test
    void shouldLayerWithoutMutatingBase() {
        Policy base = Policy.fromString(SAMPLE);
        Policy layered = base.replace(Map.of("default", "pbkdf2_sha256", "sha512_crypt.min_rounds", 8000));

        assertThat(layered.defaultScheme()).contains("pbkdf2_sha256");
        assertThat(layered.getOptions("sha512_crypt").minRounds()).isEqualTo(8000);
        assertThat(layered.schemes()).isEqualTo(base.schemes());
        assertThat(base.defaultScheme()).contains("sha512_crypt");
        assertThat(base.getOptions("sha512_crypt").minRounds()).isEqualTo(5000);
    }

    @Test
    void shouldRemoveOptionWhenOverlaidWithNull() {
        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put("sha512_crypt.min_rounds", null);

        Policy policy = Policy.fromString(SAMPLE).replace(overlay);

        assertThat(policy.getOptions("sha512_crypt").minRounds()).isNull();
    }

    @Test
    void shouldMergeAssociatively() {
        Policy a = Policy.fromString(SAMPLE);
        Map<String, Object> b = Map.of("all.vary_rounds", "20%", "pbkdf2_sha256.rounds", 3000);
        String c = "default = pbkdf2_sha256\nall.vary_rounds = 100\n";

        Policy folded = Policy.fromSources(List.of(a, b, c));

        assertThat(folded.toMap()).isEqualTo(a.replace(b).replace(Policy.fromString(c)).toMap());
        assertThat(folded.getOptions("pbkdf2_sha256").varyRounds()).isEqualTo(new VaryRounds(100, false));
        assertThat(folded.getOptions("pbkdf2_sha256").rounds()).isEqualTo(3000);
    }

    @Test
    void shouldCarryNullRemovalsThroughSources() {
        Map<String, Object> a = Map.of("schemes", "sha512_crypt, pbkdf2_sha1", "all.vary_rounds", "10%");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("all.vary_rounds", null);

        Policy folded = Policy.fromSources(List.of(a, b));

        assertThat(folded).isEqualTo(Policy.of(a).replace(b));
        assertThat(folded.toMap()).containsOnlyKeys("schemes");
    }

    @Test
    void shouldCarryEmptySchemesThroughSources() {
        Map<String, Object> a = Map.of("schemes", "sha512_crypt, pbkdf2_sha1", "default", "sha512_crypt");
        Map<String, Object> b = Map.of("schemes", "");

        Policy folded = Policy.fromSources(List.of(a, b));

        assertThat(folded).isEqualTo(Policy.of(a).replace(b));
        assertThat(folded.hasSchemes()).isFalse();
        assertThat(folded.defaultScheme()).contains("sha512_crypt");
    }

    @Test
    void shouldSerializeEqualPoliciesIdentically() {
        Policy first = Policy.of(Map.of("schemes", "x, y", "deprecated", "x, y"));
        Policy second = Policy.of(Map.of("schemes", "x, y", "deprecated", "y, x"));

        assertThat(first).isEqualTo(second);
        assertThat(first.toMap()).isEqualTo(second.toMap());
        assertThat(second.toMap().get("deprecated")).isEqualTo(List.of("x", "y"));
        assertThat(first.toText()).isEqualTo(second.toText());
    }

    @Test
    void shouldRoundTripThroughMap() {
        Policy policy = Policy.fromString(SAMPLE);

        assertThat(Policy.of(policy.toMap())).isEqualTo(policy);
        assertThat(policy.toMap())
                .containsEntry("all.vary_rounds", "10%")
                .containsEntry("admin.default_rounds", 30000)
                .containsEntry("admin.sha512_crypt.default_rounds", 40000);
    }

    @Test
    void shouldRoundTripThroughText() {
        Policy policy = Policy.fromString(SAMPLE);

        String text = policy.toText();

        assertThat(text).startsWith("[passhash]\n").contains("schemes = sha512_crypt, pbkdf2_sha256, pbkdf2_sha1");
        assertThat(Policy.fromString(text)).isEqualTo(policy);
    }

    @Test
    void shouldOmitEmptyEntriesFromMap() {
        assertThat(Policy.of(Map.of("all.rounds", 10)).toMap()).containsOnlyKeys("all.rounds");
    }

    @Test
    void shouldResolveSchemesAgainstRegistry() {
        HandlerRegistry registry = HandlerRegistry.of(new Pbkdf2HandlerFactory(), new ShaCryptHandlerFactory());
        Policy policy = Policy.of(Map.of("schemes", "sha512_crypt, pbkdf2_sha1", "default", "pbkdf2_sha1"));

        Map<String, Object> resolved = policy.toMap(registry);

        assertThat(resolved.get("schemes")).asInstanceOf(InstanceOfAssertFactories.LIST)
                .extracting(h -> ((PasswordHandler) h).name())
                .containsExactly("sha512_crypt", "pbkdf2_sha1");
        assertThat(((PasswordHandler) resolved.get("default")).name()).isEqualTo("pbkdf2_sha1");
        assertThat(Policy.of(resolved)).isEqualTo(policy);

        Policy unknown = Policy.of(Map.of("schemes", "md5_crypt"));
        assertThatThrownBy(() -> unknown.toMap(registry)).isInstanceOf(UnknownSchemeException.class);
    }

    @Test
    void shouldLoadFromPathAndSourceDispatch(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("policy.ini");
        Files.writeString(file, SAMPLE);

        Policy expected = Policy.fromString(SAMPLE);
        assertThat(Policy.fromPath(file)).isEqualTo(expected);
        assertThat(Policy.fromSource(file)).isEqualTo(expected);
        assertThat(Policy.fromSource(file.toString())).isEqualTo(expected);
        assertThat(Policy.fromSource(SAMPLE)).isEqualTo(expected);
        assertThat(Policy.fromSource(expected)).isSameAs(expected);
    }

    @Test
    void shouldRejectUnsupportedSources(@TempDir Path dir) {
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.fromSource(42));
        assertThatIllegalArgumentException().isThrownBy(() -> Policy.fromSources(List.of()));
        assertThatThrownBy(() -> Policy.fromSource(dir.resolve("missing.ini")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
