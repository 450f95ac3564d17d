package com.codeops.drive.entity.enums;

public enum ShareTargetType {
    FILE,
    FOLDER
}
