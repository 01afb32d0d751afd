package com.example.burger.application.service;

import com.example.burger.application.dto.BurgerOrderResult;
import com.example.burger.application.dto.OrderBurgerCommand;
import com.example.burger.application.port.in.OrderBurgerUseCase;
import com.example.burger.domain.model.Burger;
import com.example.burger.domain.model.BurgerType;
import com.example.burger.domain.model.BurgerTypes;
import com.example.burger.domain.store.BurgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application service that routes burger orders to the matching store.
 */
@Service
public class BurgerOrderService implements OrderBurgerUseCase {

    private static final Logger log = LoggerFactory.getLogger(BurgerOrderService.class);

    private final Map<String, BurgerStore> storesByName = new LinkedHashMap<>();

    public BurgerOrderService(List<BurgerStore> stores) {
        for (BurgerStore store : stores) {
            if (storesByName.putIfAbsent(store.getName(), store) != null) {
                throw new IllegalArgumentException("Duplicate burger store name: " + store.getName());
            }
        }
        log.info("Burger stores available: {}", storesByName.keySet());
    }

    @Override
    public BurgerOrderResult orderBurger(OrderBurgerCommand command) {
        log.debug("Order from {}: {} at store '{}'",
                command.customer(), command.burgerType(), command.storeName());

        BurgerStore store = findStore(command.storeName());
        BurgerType type = BurgerTypes.of(command.burgerType());

        Burger burger = store.order(type);
        log.info("{} ordered a {}", command.customer(), burger.getName());

        return BurgerOrderResult.of(command.customer(), store.getName(), burger);
    }

    /**
     * Returns the names of the registered stores.
     */
    public Set<String> storeNames() {
        return Collections.unmodifiableSet(storesByName.keySet());
    }

    private BurgerStore findStore(String storeName) {
        BurgerStore store = storesByName.get(storeName);
        if (store == null) {
            throw new IllegalArgumentException(
                    "Unknown burger store: " + storeName + ". Available stores: " + storesByName.keySet());
        }
        return store;
    }
}
