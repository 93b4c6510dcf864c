package info.isaksson.erland.scltoxml.ir.code;

/** Scope of a variable or constant reference, named as in the interchange XML {@code Access@Scope}. */
public enum AccessScope {
    LOCAL_VARIABLE("LocalVariable", true),
    LOCAL_CONSTANT("LocalConstant", true),
    GLOBAL_VARIABLE("GlobalVariable", false),
    GLOBAL_CONSTANT("GlobalConstant", false);

    private final String xmlName;
    private final boolean local;

    AccessScope(String xmlName, boolean local) {
        this.xmlName = xmlName;
        this.local = local;
    }

    public String xmlName() {
        return xmlName;
    }

    /** Local references render with a {@code #} prefix, global ones in double quotes. */
    public boolean isLocal() {
        return local;
    }

    public boolean isConstant() {
        return this == LOCAL_CONSTANT || this == GLOBAL_CONSTANT;
    }

    public static AccessScope fromXmlName(String name) {
        if (name == null) return null;
        for (AccessScope s : values()) {
            if (s.xmlName.equals(name)) return s;
        }
        return null;
    }
}
