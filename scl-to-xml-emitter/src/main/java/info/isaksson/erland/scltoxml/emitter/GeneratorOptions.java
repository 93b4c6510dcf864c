package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.scl.ScopeRules;

/** Options for generating interchange XML. */
public final class GeneratorOptions {
    public static final int DEFAULT_UID_START = 21;
    public static final String DEFAULT_ENGINEERING_VERSION = "V17";

    /**
     * First {@code UId} of the structured-code nodes. The schema expects it to stay clear of the
     * identities used by the wrapper objects of a compile unit.
     */
    public final int uidStart;

    /** Used when the document does not name an engineering version. */
    public final String engineeringVersion;

    public final ScopeRules scopeRules;

    public GeneratorOptions(int uidStart, String engineeringVersion, ScopeRules scopeRules) {
        if (uidStart < 0) throw new IllegalArgumentException("uidStart must not be negative: " + uidStart);
        this.uidStart = uidStart;
        this.engineeringVersion = engineeringVersion == null || engineeringVersion.isBlank()
                ? DEFAULT_ENGINEERING_VERSION
                : engineeringVersion.trim();
        this.scopeRules = scopeRules == null ? ScopeRules.defaults() : scopeRules;
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(DEFAULT_UID_START, DEFAULT_ENGINEERING_VERSION, ScopeRules.defaults());
    }

    public GeneratorOptions withUidStart(int start) {
        return new GeneratorOptions(start, engineeringVersion, scopeRules);
    }

    public GeneratorOptions withScopeRules(ScopeRules rules) {
        return new GeneratorOptions(uidStart, engineeringVersion, rules);
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
                "uidStart=" + uidStart +
                ", engineeringVersion='" + engineeringVersion + '\'' +
                '}';
    }
}
