package com.fastalert.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface EnableAlertPipeline {

    /**
     * 是否启动维护与健康探测的后台任务
     */
    boolean value() default true;
}
