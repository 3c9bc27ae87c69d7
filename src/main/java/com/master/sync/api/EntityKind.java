package com.master.sync.api;

/**
 * Entities synchronized with the master system. The sheet name selects the entity's
 * layout in the column configuration workbook.
 */
public enum EntityKind {
    ORGANIZATION("組織", "organization"),
    USER("ユーザー情報", "user"),
    LOCATION("事業所", "location"),
    USER_GROUP("ユーザーグループ", "usergroup");

    private final String sheetName;
    private final String fileBaseName;

    EntityKind(String sheetName, String fileBaseName) {
        this.sheetName = sheetName;
        this.fileBaseName = fileBaseName;
    }

    public String getSheetName() {
        return sheetName;
    }

    /**
     * Base name of the exported change-set files.
     */
    public String getFileBaseName() {
        return fileBaseName;
    }
}
