package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Block header information shared by all three representations.
 *
 * <p>Absent values fall back to the defaults the engineering software assumes: block number 1,
 * language SCL (DB for data blocks), optimized memory layout, ENO not set automatically.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"blockName", "blockNumber", "blockType", "programmingLanguage", "memoryLayout", "memoryReserve",
        "enoSetting", "engineeringVersion", "returnType", "version", "author", "family", "title", "description", "instanceOfName"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BlockMetadata {
    public static final String VOID = "Void";

    public final String blockName;
    public final int blockNumber;
    public final BlockKind blockType;
    public final String programmingLanguage;
    public final MemoryLayout memoryLayout;
    public final Integer memoryReserve;
    public final boolean enoSetting;
    public final String engineeringVersion;

    /** Functions only; {@value #VOID} when the header declares no return type. */
    public final String returnType;

    public final String version;
    public final String author;
    public final String family;
    public final String title;

    /** Block comment. */
    public final String description;

    /** Instance data blocks only: name of the function block the instance belongs to. */
    public final String instanceOfName;

    @JsonCreator
    public BlockMetadata(
            @JsonProperty("blockName") String blockName,
            @JsonProperty("blockNumber") Integer blockNumber,
            @JsonProperty("blockType") BlockKind blockType,
            @JsonProperty("programmingLanguage") String programmingLanguage,
            @JsonProperty("memoryLayout") MemoryLayout memoryLayout,
            @JsonProperty("memoryReserve") Integer memoryReserve,
            @JsonProperty("enoSetting") boolean enoSetting,
            @JsonProperty("engineeringVersion") String engineeringVersion,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("version") String version,
            @JsonProperty("author") String author,
            @JsonProperty("family") String family,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("instanceOfName") String instanceOfName
    ) {
        this.blockName = blockName;
        this.blockNumber = blockNumber == null || blockNumber < 1 ? 1 : blockNumber;
        this.blockType = blockType == null ? BlockKind.FUNCTION_BLOCK : blockType;
        this.programmingLanguage = programmingLanguage == null || programmingLanguage.isBlank()
                ? (this.blockType.isDataBlock() ? "DB" : "SCL")
                : programmingLanguage;
        this.memoryLayout = memoryLayout == null ? MemoryLayout.OPTIMIZED : memoryLayout;
        this.memoryReserve = memoryReserve;
        this.enoSetting = enoSetting;
        this.engineeringVersion = blankToNull(engineeringVersion);
        this.returnType = this.blockType == BlockKind.FUNCTION
                ? (returnType == null || returnType.isBlank() ? VOID : returnType.trim())
                : null;
        this.version = blankToNull(version);
        this.author = blankToNull(author);
        this.family = blankToNull(family);
        this.title = blankToNull(title);
        this.description = blankToNull(description);
        this.instanceOfName = this.blockType == BlockKind.INSTANCE_DB ? blankToNull(instanceOfName) : null;
    }

    public static Builder builder(String blockName, BlockKind blockType) {
        return new Builder(blockName, blockType);
    }

    public Builder toBuilder() {
        Builder b = new Builder(blockName, blockType);
        b.blockNumber = blockNumber;
        b.programmingLanguage = programmingLanguage;
        b.memoryLayout = memoryLayout;
        b.memoryReserve = memoryReserve;
        b.enoSetting = enoSetting;
        b.engineeringVersion = engineeringVersion;
        b.returnType = returnType;
        b.version = version;
        b.author = author;
        b.family = family;
        b.title = title;
        b.description = description;
        b.instanceOfName = instanceOfName;
        return b;
    }

    /** Whether a function declares a non-void return type. */
    public boolean hasReturnValue() {
        return returnType != null && !VOID.equalsIgnoreCase(returnType);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockMetadata)) return false;
        BlockMetadata that = (BlockMetadata) o;
        return blockNumber == that.blockNumber &&
                enoSetting == that.enoSetting &&
                Objects.equals(blockName, that.blockName) &&
                blockType == that.blockType &&
                Objects.equals(programmingLanguage, that.programmingLanguage) &&
                memoryLayout == that.memoryLayout &&
                Objects.equals(memoryReserve, that.memoryReserve) &&
                Objects.equals(engineeringVersion, that.engineeringVersion) &&
                Objects.equals(returnType, that.returnType) &&
                Objects.equals(version, that.version) &&
                Objects.equals(author, that.author) &&
                Objects.equals(family, that.family) &&
                Objects.equals(title, that.title) &&
                Objects.equals(description, that.description) &&
                Objects.equals(instanceOfName, that.instanceOfName);
    }

    @Override public int hashCode() {
        return Objects.hash(blockName, blockNumber, blockType, programmingLanguage, memoryLayout, memoryReserve,
                enoSetting, engineeringVersion, returnType, version, author, family, title, description,
                instanceOfName);
    }

    @Override public String toString() {
        return blockType.code() + " \"" + blockName + "\"";
    }

    /** Mutable collector used by the readers while a header is being parsed. */
    public static final class Builder {
        public String blockName;
        public BlockKind blockType;
        public Integer blockNumber;
        public String programmingLanguage;
        public MemoryLayout memoryLayout;
        public Integer memoryReserve;
        public boolean enoSetting;
        public String engineeringVersion;
        public String returnType;
        public String version;
        public String author;
        public String family;
        public String title;
        public String description;
        public String instanceOfName;

        private Builder(String blockName, BlockKind blockType) {
            this.blockName = blockName;
            this.blockType = blockType;
        }

        public BlockMetadata build() {
            return new BlockMetadata(blockName, blockNumber, blockType, programmingLanguage, memoryLayout,
                    memoryReserve, enoSetting, engineeringVersion, returnType, version, author, family,
                    title, description, instanceOfName);
        }
    }
}
