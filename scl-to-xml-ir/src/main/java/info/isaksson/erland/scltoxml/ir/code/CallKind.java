package info.isaksson.erland.scltoxml.ir.code;

/** How a call names its target. */
public enum CallKind {
    /** {@code #instance(...)}: a function block instance declared locally. */
    INSTANCE("FB"),
    /** {@code "Block"(...)}: a function or a single-instance data block. */
    GLOBAL("FC"),
    /** {@code ABS(...)}: a built-in instruction. */
    INSTRUCTION("Instruction");

    private final String blockType;

    CallKind(String blockType) {
        this.blockType = blockType;
    }

    /** Value of {@code CallInfo@BlockType}. */
    public String blockType() {
        return blockType;
    }

    public static CallKind fromBlockType(String blockType) {
        if (blockType == null) return INSTRUCTION;
        return switch (blockType) {
            case "FB" -> INSTANCE;
            case "FC" -> GLOBAL;
            default -> INSTRUCTION;
        };
    }
}
