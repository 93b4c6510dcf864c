package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.code.AccessScope;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides the scope of a plain variable reference.
 *
 * <p>{@code #name} is a local variable unless {@code name} is declared in the block's constant
 * section. {@code "name"} is a global variable unless it is listed as a global constant or matches
 * the global-constant naming pattern. Names compare case-insensitively.</p>
 */
public final class ScopeRules {
    public static final String DEFAULT_GLOBAL_CONSTANT_PATTERN = "(?i)gc_\\w*";

    private final Set<String> localConstants;
    private final Set<String> globalConstants;
    private final Pattern globalConstantPattern;

    public ScopeRules(Collection<String> localConstants, Collection<String> globalConstants, String globalConstantPattern) {
        this.localConstants = normalize(localConstants);
        this.globalConstants = normalize(globalConstants);
        this.globalConstantPattern = globalConstantPattern == null || globalConstantPattern.isBlank()
                ? null
                : Pattern.compile(globalConstantPattern);
    }

    public static ScopeRules defaults() {
        return new ScopeRules(null, null, DEFAULT_GLOBAL_CONSTANT_PATTERN);
    }

    public ScopeRules withLocalConstants(Collection<String> names) {
        ScopeRules copy = new ScopeRules(names, null, null);
        return new ScopeRules(copy.localConstants, globalConstants,
                globalConstantPattern == null ? null : globalConstantPattern.pattern());
    }

    public AccessScope localScope(String name) {
        return name != null && localConstants.contains(name.toLowerCase(Locale.ROOT))
                ? AccessScope.LOCAL_CONSTANT
                : AccessScope.LOCAL_VARIABLE;
    }

    public AccessScope globalScope(String name) {
        if (name == null) return AccessScope.GLOBAL_VARIABLE;
        if (globalConstants.contains(name.toLowerCase(Locale.ROOT))) return AccessScope.GLOBAL_CONSTANT;
        if (globalConstantPattern != null && globalConstantPattern.matcher(name).matches()) {
            return AccessScope.GLOBAL_CONSTANT;
        }
        return AccessScope.GLOBAL_VARIABLE;
    }

    private static Set<String> normalize(Collection<String> names) {
        if (names == null) return Set.of();
        return names.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
