package com.libragraph.passhash.handlers.normalize;

import com.libragraph.passhash.handlers.api.RoundsBounds;
import com.libragraph.passhash.handlers.api.SaltBounds;
import com.libragraph.passhash.handlers.api.SaltUnit;
import com.libragraph.passhash.handlers.api.SettingOutOfRangeException;
import org.jboss.logging.Logger;

import java.util.Arrays;

/**
 * Applies a handler's salt and rounds bounds to requested settings.
 *
 * <p>In strict mode every violation raises {@link SettingOutOfRangeException}. In relaxed
 * mode correctable violations are fixed (clamped, truncated or defaulted) and logged at WARN.
 * A salt shorter than the minimum, or one using characters outside the charset, is never
 * correctable.
 */
public class SettingNormalizer {

    private static final Logger log = Logger.getLogger(SettingNormalizer.class);

    private static final SettingNormalizer SECURE = new SettingNormalizer(SaltSource.secureRandom());

    private final SaltSource saltSource;

    public SettingNormalizer(SaltSource saltSource) {
        this.saltSource = saltSource;
    }

    /**
     * Shared normalizer drawing salts from {@link java.security.SecureRandom}.
     */
    public static SettingNormalizer secure() {
        return SECURE;
    }

    public long normalizeRounds(String scheme, Long requested, RoundsBounds bounds, boolean strict) {
        if (requested == null) {
            if (strict) {
                throw new SettingOutOfRangeException(scheme, "rounds", "no rounds specified");
            }
            return bounds.defaultRounds();
        }
        long rounds = requested;
        if (rounds < bounds.min()) {
            String msg = "rounds " + rounds + " below minimum " + bounds.min();
            if (strict || bounds.strictBounds()) {
                throw new SettingOutOfRangeException(scheme, "rounds", msg);
            }
            log.warnf("%s: %s, clamping", scheme, msg);
            return bounds.min();
        }
        if (rounds > bounds.max()) {
            String msg = "rounds " + rounds + " above maximum " + bounds.max();
            if (strict) {
                throw new SettingOutOfRangeException(scheme, "rounds", msg);
            }
            log.warnf("%s: %s, clamping", scheme, msg);
            return bounds.max();
        }
        return rounds;
    }

    /**
     * Validates a supplied salt, or generates one of {@code saltSize} units
     * (the default size when null).
     */
    public byte[] normalizeSalt(String scheme, byte[] requested, Integer saltSize,
                                SaltBounds bounds, boolean strict) {
        if (requested == null) {
            if (strict) {
                throw new SettingOutOfRangeException(scheme, "salt", "no salt specified");
            }
            int size = normalizeSaltSize(scheme, saltSize, bounds, false);
            return bounds.unit() == SaltUnit.CHARS
                    ? saltSource.chars(bounds.defaultCharset(), size)
                    : saltSource.bytes(size);
        }
        if (!bounds.acceptsAll(requested)) {
            throw new SettingOutOfRangeException(scheme, "salt",
                    "salt contains characters outside " + bounds.charset());
        }
        String unit = bounds.unit() == SaltUnit.CHARS ? "chars" : "bytes";
        if (requested.length < bounds.min()) {
            throw new SettingOutOfRangeException(scheme, "salt",
                    "salt too small (" + requested.length + " " + unit + ", min " + bounds.min() + ")");
        }
        if (requested.length > bounds.max()) {
            String msg = "salt too large (" + requested.length + " " + unit + ", max " + bounds.max() + ")";
            if (strict) {
                throw new SettingOutOfRangeException(scheme, "salt", msg);
            }
            log.warnf("%s: %s, truncating", scheme, msg);
            return Arrays.copyOf(requested, bounds.max());
        }
        return requested;
    }

    public int normalizeSaltSize(String scheme, Integer requested, SaltBounds bounds, boolean strict) {
        if (requested == null) {
            return bounds.defaultSize();
        }
        int size = requested;
        if (size >= bounds.min() && size <= bounds.max()) {
            return size;
        }
        String msg = "salt_size " + size + " outside " + bounds.min() + ".." + bounds.max();
        if (strict) {
            throw new SettingOutOfRangeException(scheme, "salt_size", msg);
        }
        int clamped = Math.max(bounds.min(), Math.min(bounds.max(), size));
        log.warnf("%s: %s, using %d", scheme, msg, clamped);
        return clamped;
    }
}
