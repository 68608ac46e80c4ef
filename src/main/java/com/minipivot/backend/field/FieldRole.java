package com.minipivot.backend.field;

/**
 * 推断出的字段角色，供字段分配方使用。
 */
public enum FieldRole {
    NUMERIC,
    DATE,
    TEXT
}
