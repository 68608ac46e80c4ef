package com.minipivot.api.entity.request;

import javax.validation.constraints.NotNull;

public class DecisionRequest {

    /**
     * true：裁剪列后继续；false：取消并回退到上一次配置
     */
    @NotNull(message = "proceed 不能为空")
    private Boolean proceed;

    public Boolean getProceed() {
        return proceed;
    }

    public void setProceed(Boolean proceed) {
        this.proceed = proceed;
    }
}
