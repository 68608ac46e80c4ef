package com.minipivot.backend.session;

/**
 * 对列数告警的处理决定。
 */
public enum Decision {
    /** 继续计算，并裁剪列组合 */
    PROCEED_WITH_LIMITING,
    /** 放弃本次配置，回退到上一次被接受的配置 */
    CANCEL;

    public static Decision of(boolean proceed) {
        return proceed ? PROCEED_WITH_LIMITING : CANCEL;
    }
}
