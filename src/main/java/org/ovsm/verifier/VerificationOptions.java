package org.ovsm.verifier;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.ovsm.generator.VerificationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 验证门面的配置。所有字段都有默认值，可以用 builder 覆盖，
 * 也可以从 ovsm.verify.* 属性读取。
 */
@Getter
@Builder(toBuilder = true)
public final class VerificationOptions {

    private static final Logger logger = LoggerFactory.getLogger(VerificationOptions.class);

    public static final String RESOURCE = "ovsm-verify.properties";
    private static final String PREFIX = "ovsm.verify.";

    // 为 true 时 verifyOrThrow 遇到失败的验证条件会抛出异常
    @Builder.Default
    private final boolean requireVerification = false;
    @Builder.Default
    private final String leanPath = "lean";
    @Builder.Default
    private final String lakePath = "lake";
    // 配套 Lean 库目录，null 表示不使用
    private final Path leanLibraryPath;
    @Builder.Default
    private final int timeoutSeconds = 60;
    @Builder.Default
    private final VerificationProperties properties = VerificationProperties.all();
    @Builder.Default
    private final boolean enableCache = true;
    @Builder.Default
    private final Path outputDir = Path.of(System.getProperty("java.io.tmpdir"), "ovsm_verify");
    @Builder.Default
    private final boolean keepGenerated = false;
    @Builder.Default
    private final boolean smtFallback = false;
    @Builder.Default
    private final int smtTimeoutMillis = 5000;

    public static VerificationOptions defaults() {
        return builder().build();
    }

    /**
     * 从属性读取配置，缺失的键保持默认值。
     * @throws IllegalArgumentException 值无法解析时。
     */
    public static VerificationOptions fromProperties(Properties props) {
        VerificationOptionsBuilder builder = builder();
        String preset = value(props, "preset");
        if (preset != null) {
            builder.properties(VerificationProperties.preset(preset));
        }
        String lean = value(props, "lean-path");
        if (lean != null) {
            builder.leanPath(lean);
        }
        String lake = value(props, "lake-path");
        if (lake != null) {
            builder.lakePath(lake);
        }
        String library = value(props, "lean-library-path");
        if (library != null) {
            builder.leanLibraryPath(Path.of(library));
        }
        String output = value(props, "output-dir");
        if (output != null) {
            builder.outputDir(Path.of(output));
        }
        Integer timeout = intValue(props, "timeout-seconds");
        if (timeout != null) {
            builder.timeoutSeconds(timeout);
        }
        Integer smtTimeout = intValue(props, "smt-timeout-millis");
        if (smtTimeout != null) {
            builder.smtTimeoutMillis(smtTimeout);
        }
        Boolean flag = boolValue(props, "require-verification");
        if (flag != null) {
            builder.requireVerification(flag);
        }
        flag = boolValue(props, "enable-cache");
        if (flag != null) {
            builder.enableCache(flag);
        }
        flag = boolValue(props, "keep-generated");
        if (flag != null) {
            builder.keepGenerated(flag);
        }
        flag = boolValue(props, "smt-fallback");
        if (flag != null) {
            builder.smtFallback(flag);
        }
        return builder.build();
    }

    /**
     * 读取类路径上的 ovsm-verify.properties，不存在时返回默认配置。
     */
    public static VerificationOptions load() {
        try (InputStream in = VerificationOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("类路径上没有 {}，使用默认配置", RESOURCE);
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new VerificationException("Failed to read " + RESOURCE, e);
        }
    }

    private static String value(Properties props, String key) {
        String raw = props.getProperty(PREFIX + key);
        return StringUtils.isBlank(raw) ? null : raw.trim();
    }

    private static Integer intValue(Properties props, String key) {
        String raw = value(props, key);
        if (raw == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(raw);
            if (parsed <= 0) {
                throw new IllegalArgumentException("Value of " + PREFIX + key + " must be positive: " + raw);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static Boolean boolValue(Properties props, String key) {
        String raw = value(props, key);
        if (raw == null) {
            return null;
        }
        return switch (raw.toLowerCase()) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + raw);
        };
    }

    @Override
    public String toString() {
        return "VerificationOptions{require=" + requireVerification + ", lean=" + leanPath
                + ", timeout=" + timeoutSeconds + "s, " + properties + ", cache=" + enableCache
                + ", smt=" + smtFallback + "}";
    }
}
