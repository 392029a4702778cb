package com.crescent.gateway.core.hook;

/**
 * 网关钩子的公共父接口
 * <p>
 * 具体能力由子接口声明，一个实现类可以同时实现多个子接口。
 * 实现类注册为 Spring Bean 即可生效，按 {@link org.springframework.core.annotation.Order} 排序执行。
 */
public interface GatewayHook {

    /**
     * 钩子名称，用于日志
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
