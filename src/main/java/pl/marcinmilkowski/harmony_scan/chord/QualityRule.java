package pl.marcinmilkowski.harmony_scan.chord;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the classification decision table: when {@code test} holds, {@code outcome} gives the quality.
 */
public record QualityRule(String name, Predicate<ChordFacts> test, Function<ChordFacts, Quality> outcome) {

    /**
     * A rule that always yields the same quality.
     */
    public static QualityRule of(String name, Predicate<ChordFacts> test, Quality quality) {
        return new QualityRule(name, test, f -> quality);
    }

    public boolean appliesTo(ChordFacts facts) {
        return test.test(facts);
    }

    public Quality qualityFor(ChordFacts facts) {
        return outcome.apply(facts);
    }

    @Override
    public String toString() {
        return name;
    }
}
