package org.docstore.annotation;

import java.lang.annotation.*;

@Target(ElementType.METHOD) // 作用在方法上
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LogAction {
    String value() default "";      // 模块名称，如 "DocumentController"
    String action() default "";     // 动作类型，如 "putDocument"
    boolean logArgs() default true; // 是否记录入参
}
