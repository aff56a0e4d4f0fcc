package com.layout;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.policy.Combinator;
import com.layout.policy.Policy;
import com.layout.policy.PolicyOverride;
import com.layout.resolver.DecisionResolver;
import com.layout.resolver.PathPolicy;
import com.layout.resolver.Resolution;
import com.layout.spring.EnableLayoutPolicy;
import com.layout.token.FormatToken;
import com.layout.token.FormatTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Optional;

/**
 * Example Spring Boot application walking one search path through a call expression.
 */
@SpringBootApplication
@EnableLayoutPolicy
public class LayoutPolicyApplication {

    private static final Logger log = LoggerFactory.getLogger(LayoutPolicyApplication.class);

    private static final List<Split> DEFAULT_SPLITS = List.of(
            new Split("space", 0), new Split("newline", 1));

    public static void main(String[] args) {
        SpringApplication.run(LayoutPolicyApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DecisionResolver resolver) {
        return args -> {
            String source = args.length > 0 ? String.join(" ", args) : "call(first, second, third)";
            log.info("=== Layout policy demo: {} ===", source);

            FormatTokens tokens = FormatTokens.tokenize(source);
            PathPolicy path = resolver.initialPath();

            for (FormatToken ft : tokens) {
                Resolution resolution = resolver.resolve(path, new Decision(ft, DEFAULT_SPLITS));
                path = resolution.getPathPolicy();
                log.info("{} -> {}", ft, resolution.getSplits());

                if (ft.left().text().equals("(")) {
                    Optional<FormatToken> close = tokens.findByRight(")", ft.index());
                    if (close.isPresent()) {
                        path = resolver.attach(path, onePerLine(close.get()), Combinator.AND_THEN);
                    }
                }
            }

            log.info("=== Demo finished, remaining policy: {} ===", path.describe());
        };
    }

    /**
     * Once arguments open, every comma up to the closing paren must break.
     */
    private static Policy onePerLine(FormatToken close) {
        return Policy.before(close.right(), "one-per-line", PolicyOverride.when(
                d -> d.formatToken().left().text().equals(",") && d.hasSplit("newline"),
                d -> d.splits().stream().filter(s -> s.name().equals("newline")).toList()));
    }
}
