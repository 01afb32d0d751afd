package com.example.burger.infrastructure.adapter.in.runner;

import com.example.burger.application.dto.BurgerOrderResult;
import com.example.burger.application.dto.OrderBurgerCommand;
import com.example.burger.application.port.in.OrderBurgerUseCase;
import com.example.burger.domain.exception.DomainException;
import com.example.burger.infrastructure.config.BurgerDemoProperties;
import com.example.burger.infrastructure.config.BurgerDemoProperties.DemoOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Places the configured demo orders once the application has started.
 * A rejected order is logged and does not stop the remaining ones.
 */
@Component
@ConditionalOnProperty(prefix = "burger.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BurgerDemoRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BurgerDemoRunner.class);

    private final OrderBurgerUseCase orderBurgerUseCase;
    private final BurgerDemoProperties properties;

    public BurgerDemoRunner(OrderBurgerUseCase orderBurgerUseCase, BurgerDemoProperties properties) {
        this.orderBurgerUseCase = orderBurgerUseCase;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<BurgerOrderResult> served = placeOrders();
        log.info("Demo finished: {} of {} orders served", served.size(), properties.orders().size());
    }

    /**
     * Places every configured order.
     *
     * @return results of the orders that were served
     */
    public List<BurgerOrderResult> placeOrders() {
        List<BurgerOrderResult> served = new ArrayList<>();
        for (DemoOrder order : properties.orders()) {
            try {
                served.add(orderBurgerUseCase.orderBurger(
                        new OrderBurgerCommand(order.customer(), order.store(), order.type())));
            } catch (DomainException | IllegalArgumentException ex) {
                log.warn("Order rejected for {}: {}", order.customer(), ex.getMessage());
            }
        }
        return served;
    }
}
