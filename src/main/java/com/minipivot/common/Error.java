package com.minipivot.common;

/**
 * 全局共享的异常常量
 */
public class Error {
    // record
    public static final Exception InvalidValueException = new RuntimeException("Invalid record value, expect string, number, boolean or null!");

    // aggregator
    public static final Exception InvalidAggregatorException = new RuntimeException("Invalid aggregator!");
    public static final Exception InvalidValueFieldException = new RuntimeException("Value field must not be blank!");

    // request
    public static final Exception InvalidGroupFieldException = new RuntimeException("Group field must not be blank!");
    public static final Exception DuplicateGroupFieldException = new RuntimeException("Duplicated group field!");

    // session
    public static final Exception NoPendingApprovalException = new RuntimeException("No pending approval!");
}
