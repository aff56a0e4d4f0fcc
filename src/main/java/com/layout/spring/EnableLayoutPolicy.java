package com.layout.spring;

import com.layout.adapter.spring.LayoutPolicyAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the layout policy engine in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableLayoutPolicy
 * public class MyFormatter {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyFormatter.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(LayoutPolicyAutoConfiguration.class)
public @interface EnableLayoutPolicy {
}
