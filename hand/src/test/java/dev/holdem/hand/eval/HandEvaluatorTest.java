package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Rank;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandEvaluatorTest {

    private static HandStrength eval(String cards) {
        return HandEvaluator.evaluate(Card.parseAll(cards));
    }

    // --- categories ---

    @Test
    void royal_flush_beats_four_deuces() {
        HandStrength royal = eval("AS KS QS JS TS");
        HandStrength quads = eval("2C 2D 2H 2S 3C");

        assertThat(royal.category()).isEqualTo(HandCategory.STRAIGHT_FLUSH);
        assertThat(quads.category()).isEqualTo(HandCategory.FOUR_OF_A_KIND);
        assertThat(royal.beats(quads)).isTrue();
        assertThat(royal.describe()).isEqualTo("Royal Flush");
    }

    @Test
    void categories_are_ordered() {
        assertThat(eval("9S 9D 9C 4H 4S")).isGreaterThan(eval("AH JH 8H 6H 2H"));
        assertThat(eval("AH JH 8H 6H 2H")).isGreaterThan(eval("9S TD JC QH KS"));
        assertThat(eval("9S TD JC QH KS")).isGreaterThan(eval("7S 7D 7C AH KS"));
        assertThat(eval("7S 7D 7C AH KS")).isGreaterThan(eval("AS AD KC KH QS"));
        assertThat(eval("AS AD KC KH QS")).isGreaterThan(eval("AS AD KC QH JS"));
        assertThat(eval("AS AD KC QH JS")).isGreaterThan(eval("AS KD QC JH 9S"));
    }

    @Test
    void wheel_is_a_five_high_straight() {
        HandStrength wheel = eval("AS 2D 3C 4H 5S");

        assertThat(wheel.category()).isEqualTo(HandCategory.STRAIGHT);
        assertThat(wheel.tiebreakers()).containsExactly(Rank.FIVE);
        assertThat(eval("2D 3C 4H 5S 6D").beats(wheel)).isTrue();
        assertThat(wheel.describe()).isEqualTo("Straight, Five high");
    }

    @Test
    void ace_does_not_wrap_around_a_straight() {
        assertThat(eval("QS KD AC 2H 3S").category()).isEqualTo(HandCategory.HIGH_CARD);
    }

    // --- tiebreaks ---

    @Test
    void kickers_decide_between_equal_pairs() {
        HandStrength nineKicker = eval("KS KD 9C 7H 2S");
        HandStrength eightKicker = eval("KH KC 8D 7S 3S");

        assertThat(nineKicker.beats(eightKicker)).isTrue();
        assertThat(nineKicker.describe()).isEqualTo("Pair of Kings");
    }

    @Test
    void same_ranks_in_different_suits_tie() {
        HandStrength spades = eval("AS KD 9C 7H 2S");
        HandStrength clubs = eval("AD KC 9H 7S 2C");

        assertThat(spades.ties(clubs)).isTrue();
        assertThat(spades).isEqualByComparingTo(clubs);
        assertThat(spades).isNotEqualTo(clubs);
    }

    @Test
    void full_house_compares_trips_before_pair() {
        HandStrength kingsFull = eval("KS KD KC 4H 4S");
        HandStrength queensFull = eval("QS QD QC AH AS");

        assertThat(kingsFull.beats(queensFull)).isTrue();
        assertThat(kingsFull.describe()).isEqualTo("Full House, Kings over Fours");
    }

    // --- best five of seven ---

    @Test
    void picks_the_best_five_of_seven() {
        HandStrength strength = HandEvaluator.evaluate(Card.parseAll("AH KH"), Card.parseAll("QH JH TH 2C 3D"));

        assertThat(strength.describe()).isEqualTo("Royal Flush");
        assertThat(strength.cards()).hasSize(5);
    }

    @Test
    void two_sets_make_a_full_house_with_the_higher_set() {
        HandStrength strength = eval("KS KD KC 4H 4S 4D 2C");

        assertThat(strength.category()).isEqualTo(HandCategory.FULL_HOUSE);
        assertThat(strength.tiebreakers()).containsExactly(Rank.KING, Rank.FOUR);
    }

    @Test
    void board_plays_when_neither_hole_card_helps() {
        HandStrength first = HandEvaluator.evaluate(Card.parseAll("2C 3D"), Card.parseAll("AS KS QS JS 9D"));
        HandStrength second = HandEvaluator.evaluate(Card.parseAll("4C 5H"), Card.parseAll("AS KS QS JS 9D"));

        assertThat(first.ties(second)).isTrue();
    }

    @Test
    void rejects_too_few_or_too_many_cards() {
        assertThatThrownBy(() -> eval("AS KS QS JS")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> eval("AS KS QS JS TS 9S 8S 7S")).isInstanceOf(IllegalArgumentException.class);
    }
}
