package com.disease.coding.core.model;

/**
 * Partial field set for a catalog update.
 * A {@code null} field is left unchanged; a supplied field must be non-blank.
 */
public record CodeEntryUpdate(String primaryCode, String secondaryCode) {

    public CodeEntryUpdate {
        if (primaryCode != null) {
            CodeEntry.requireCode(primaryCode, "primaryCode");
        }
        if (secondaryCode != null) {
            CodeEntry.requireCode(secondaryCode, "secondaryCode");
        }
    }

    public static CodeEntryUpdate primaryCode(String code) {
        return new CodeEntryUpdate(code, null);
    }

    public static CodeEntryUpdate secondaryCode(String code) {
        return new CodeEntryUpdate(null, code);
    }

    public static CodeEntryUpdate both(String primaryCode, String secondaryCode) {
        return new CodeEntryUpdate(primaryCode, secondaryCode);
    }

    /**
     * Returns true if no field is supplied.
     */
    public boolean isEmpty() {
        return primaryCode == null && secondaryCode == null;
    }

    /**
     * Merges the supplied fields onto an existing entry.
     */
    public CodeEntry applyTo(CodeEntry current) {
        CodeEntry merged = current;
        if (primaryCode != null) {
            merged = merged.withPrimaryCode(primaryCode);
        }
        if (secondaryCode != null) {
            merged = merged.withSecondaryCode(secondaryCode);
        }
        return merged;
    }
}
