package com.example.burger.application.port.in;

import com.example.burger.application.dto.BurgerOrderResult;
import com.example.burger.application.dto.OrderBurgerCommand;

/**
 * Inbound port for ordering burgers.
 */
public interface OrderBurgerUseCase {

    /**
     * Orders a burger from the store named in the command.
     *
     * @param command the order command
     * @return the served burger's details
     * @throws com.example.burger.domain.exception.UnrecognizedBurgerTypeException
     *         if the store does not make the requested type
     * @throws IllegalArgumentException if the store or type code is unknown
     */
    BurgerOrderResult orderBurger(OrderBurgerCommand command);
}
