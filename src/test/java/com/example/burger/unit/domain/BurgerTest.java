package com.example.burger.unit.domain;

import com.example.burger.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for burger products and their lifecycle.
 */
@DisplayName("Burger Domain Tests")
class BurgerTest {

    @Nested
    @DisplayName("Burger Composition")
    class BurgerComposition {

        @Test
        @DisplayName("should_create_burger_in_created_stage")
        void should_create_burger_in_created_stage() {
            // When
            Burger burger = new CheeseBurger();

            // Then
            assertThat(burger.getName()).isEqualTo("CheeseBurger");
            assertThat(burger.getStage()).isEqualTo(BurgerStage.CREATED);
            assertThat(burger.getBread()).isEqualTo("sesame bun");
            assertThat(burger.getSauce()).isEqualTo("ketchup");
            assertThat(burger.getToppings()).containsExactly("cheddar", "pickles", "onion");
            assertThat(burger.getSteps()).isEmpty();
        }

        @Test
        @DisplayName("should_give_each_variant_its_own_name")
        void should_give_each_variant_its_own_name() {
            assertThat(new CheeseBurger().getName()).isEqualTo("CheeseBurger");
            assertThat(new DeluxeCheeseBurger().getName()).isEqualTo("DeluxeCheeseBurger");
            assertThat(new VeganBurger().getName()).isEqualTo("VeganBurger");
            assertThat(new DeluxeVeganBurger().getName()).isEqualTo("DeluxeVeganBurger");
        }

        @Test
        @DisplayName("should_reject_duplicate_toppings")
        void should_reject_duplicate_toppings() {
            assertThatThrownBy(() -> new TestBurger(List.of("lettuce", "tomato", "lettuce")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate topping")
                    .hasMessageContaining("lettuce");
        }

        @Test
        @DisplayName("should_reject_blank_topping")
        void should_reject_blank_topping() {
            assertThatThrownBy(() -> new TestBurger(List.of("lettuce", " ")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Topping cannot be blank");
        }

        @Test
        @DisplayName("should_not_expose_mutable_toppings")
        void should_not_expose_mutable_toppings() {
            Burger burger = new VeganBurger();

            assertThatThrownBy(() -> burger.getToppings().add("bacon"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Burger Lifecycle")
    class BurgerLifecycle {

        @Test
        @DisplayName("should_move_through_stages_in_order")
        void should_move_through_stages_in_order() {
            // Given
            Burger burger = new DeluxeCheeseBurger();

            // When & Then: CREATED -> PREPARED
            burger.prepare();
            assertThat(burger.getStage()).isEqualTo(BurgerStage.PREPARED);

            // When & Then: PREPARED -> COOKED
            burger.cook();
            assertThat(burger.getStage()).isEqualTo(BurgerStage.COOKED);

            // When & Then: COOKED -> SERVED
            burger.serve();
            assertThat(burger.getStage()).isEqualTo(BurgerStage.SERVED);
        }

        @Test
        @DisplayName("should_record_variant_specific_steps")
        void should_record_variant_specific_steps() {
            // Given
            Burger burger = new DeluxeVeganBurger();

            // When
            burger.prepare();
            burger.cook();
            burger.serve();

            // Then
            assertThat(burger.getSteps()).containsExactly(
                    "Preparing DeluxeVeganBurger on a pretzel bun with chipotle vegan mayo"
                            + " and vegan cheese, avocado, lettuce, tomato, grilled onion",
                    "Smoking two plant-based patties and melting vegan cheese",
                    "Serving DeluxeVeganBurger on a board with sweet potato fries");
        }

        @Test
        @DisplayName("should_reject_skipping_a_stage")
        void should_reject_skipping_a_stage() {
            // Given: burger in CREATED stage
            Burger burger = new CheeseBurger();

            // When & Then: cannot cook before preparing
            assertThatThrownBy(burger::cook)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Cannot transition from CREATED to COOKED");
            assertThat(burger.getStage()).isEqualTo(BurgerStage.CREATED);
            assertThat(burger.getSteps()).isEmpty();
        }

        @Test
        @DisplayName("should_not_run_variant_step_when_called_out_of_order")
        void should_not_run_variant_step_when_called_out_of_order() {
            // Given: burger in CREATED stage
            TestBurger burger = new TestBurger(List.of("lettuce"));

            // When: cooking before preparing
            assertThatThrownBy(burger::cook)
                    .isInstanceOf(IllegalStateException.class);

            // Then: the variant's cooking step never ran
            assertThat(burger.cookingCalls).isZero();

            // And: it runs once the burger is in the right stage
            burger.prepare();
            burger.cook();
            assertThat(burger.cookingCalls).isEqualTo(1);
        }

        @Test
        @DisplayName("should_reject_repeating_a_stage")
        void should_reject_repeating_a_stage() {
            // Given
            Burger burger = new VeganBurger();
            burger.prepare();

            // When & Then
            assertThatThrownBy(burger::prepare)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Expected current stage: CREATED");
            assertThat(burger.getSteps()).hasSize(1);
        }

        @Test
        @DisplayName("should_reject_any_step_after_serving")
        void should_reject_any_step_after_serving() {
            // Given: served burger
            Burger burger = new CheeseBurger();
            burger.prepare();
            burger.cook();
            burger.serve();

            // When & Then
            assertThatThrownBy(burger::serve).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(burger::prepare).isInstanceOf(IllegalStateException.class);
            assertThat(burger.getStage()).isEqualTo(BurgerStage.SERVED);
        }

        @Test
        @DisplayName("SERVED should have no next stage")
        void served_should_have_no_next_stage() {
            assertThat(BurgerStage.CREATED.next()).isEqualTo(BurgerStage.PREPARED);
            assertThatThrownBy(BurgerStage.SERVED::next)
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Burger Types")
    class BurgerTypeLookup {

        @Test
        @DisplayName("should_resolve_codes_case_insensitively")
        void should_resolve_codes_case_insensitively() {
            assertThat(BurgerTypes.of("CHEESE")).isEqualTo(CheeseBurgerType.CHEESE);
            assertThat(BurgerTypes.of(" deluxe_vegan ")).isEqualTo(VeganBurgerType.DELUXE_VEGAN);
        }

        @Test
        @DisplayName("should_list_every_type_once")
        void should_list_every_type_once() {
            assertThat(BurgerTypes.all()).containsExactlyInAnyOrder(
                    CheeseBurgerType.CHEESE, CheeseBurgerType.DELUXE_CHEESE,
                    VeganBurgerType.VEGAN, VeganBurgerType.DELUXE_VEGAN);
        }

        @Test
        @DisplayName("should_reject_unknown_or_blank_codes")
        void should_reject_unknown_or_blank_codes() {
            assertThatThrownBy(() -> BurgerTypes.of("FISH"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown burger type code: FISH");

            assertThatThrownBy(() -> BurgerTypes.of(""))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThatThrownBy(() -> BurgerTypes.of(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static final class TestBurger extends AbstractBurger {

        private int cookingCalls;

        TestBurger(List<String> toppings) {
            super("TestBurger", "bun", "mustard", toppings);
        }

        @Override
        protected String describeCooking() {
            cookingCalls++;
            return "Cooking";
        }
    }
}
