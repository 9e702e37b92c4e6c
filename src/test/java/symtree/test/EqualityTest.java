// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package symtree.test;

import java.util.ArrayList;
import java.util.stream.LongStream;
import symtree.tree.Cons;
import symtree.tree.Expr;
import symtree.tree.Trees;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class EqualityTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    private final TestAtom foo = new TestAtom("foo");
    private final TestAtom bar = new TestAtom("bar");

    @Test
    void independentlyBuiltListsAreEqual() {
        final var lhs = Cons.of(Cons.of(foo, bar), bar, Cons.of(Cons.of(foo)));
        final var rhs = Cons.of(
            Cons.of(new TestAtom("foo"), new TestAtom("bar")),
            new TestAtom("bar"),
            Cons.of(Cons.of(new TestAtom("foo")))
        );
        assertThat(lhs).isNotSameAs(rhs);
        assertThat(lhs.isEqualTo(rhs)).isTrue();
        assertThat(rhs.isEqualTo(lhs)).isTrue();
        assertThat(lhs).isEqualTo(rhs);
        assertThat(lhs).hasSameHashCodeAs(rhs);
    }

    @Test
    void listsOfDifferentLengthAreNotEqual() {
        assertThat(Cons.of(foo).isEqualTo(Cons.of(foo, foo))).isFalse();
        assertThat(Cons.of(foo, foo).isEqualTo(Cons.of(foo))).isFalse();
        assertThat(Cons.of(foo).isEqualTo(Cons.nil())).isFalse();
        assertThat(Cons.nil().isEqualTo(Cons.of(foo))).isFalse();
    }

    @Test
    void listsAreNeverEqualToAtoms() {
        final var x = Cons.of(foo);
        final var y = Cons.of(foo, bar);
        final var z = Cons.of(x, bar);
        assertThat(x.isEqualTo(foo)).isFalse();
        assertThat(x.isEqualTo(bar)).isFalse();
        assertThat(x.isEqualTo(x)).isTrue();
        assertThat(x.isEqualTo(y)).isFalse();
        assertThat(y.isEqualTo(foo)).isFalse();
        assertThat(y.isEqualTo(bar)).isFalse();
        assertThat(z.isEqualTo(foo)).isFalse();
        assertThat(z.isEqualTo(bar)).isFalse();
        assertThat(Cons.nil().isEqualTo(foo)).isFalse();
        assertThat(foo.isEqualTo(Cons.nil())).isFalse();
        assertThat(x.equals("foo")).isFalse();
    }

    @Test
    void nestingMatters() {
        assertThat(Cons.of(Cons.of(foo)).isEqualTo(Cons.of(foo))).isFalse();
        assertThat(Cons.of(Cons.nil()).isEqualTo(Cons.nil())).isFalse();
        assertThat(Cons.of(foo, Cons.of(bar)).isEqualTo(Cons.of(foo, bar))).isFalse();
    }

    @Test
    void sharedTailsAreEqual() {
        final var shared = Cons.of(bar, bar, bar);
        assertThat(Cons.cons(foo, shared).isEqualTo(Cons.cons(new TestAtom("foo"), shared))).isTrue();
        assertThat(Cons.cons(foo, shared).isEqualTo(Cons.cons(bar, shared))).isFalse();
    }

    @Test
    void containsWorks() {
        final var x = Cons.of(foo);
        final var y = Cons.of(foo, bar);
        final var z = Cons.of(x, bar);
        assertThat(Cons.nil().contains(foo)).isFalse();
        assertThat(x.contains(foo)).isTrue();
        assertThat(x.contains(bar)).isFalse();
        assertThat(x.contains(x)).isTrue();
        assertThat(y.contains(foo)).isTrue();
        assertThat(y.contains(bar)).isTrue();
        assertThat(z.contains(foo)).isTrue();
        assertThat(z.contains(bar)).isTrue();
        assertThat(z.contains(Cons.of(foo))).isTrue();
        assertThat(foo.contains(foo)).isTrue();
        assertThat(foo.contains(x)).isFalse();
    }

    @Test
    void containsIsSelfInclusive() {
        final var list = Cons.of(foo, bar);
        assertThat(list.contains(Cons.of(foo, bar))).isTrue();
        assertThat(list.contains(Cons.of(bar))).isTrue();
        assertThat(list.contains(Cons.nil())).isTrue();
        assertThat(Cons.nil().contains(Cons.nil())).isTrue();
        assertThat(list.contains(Cons.of(foo))).isFalse();
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void equalityIsReflexiveAndSymmetric(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 200; i += 1) {
            final var lhs = RandomUtils.generateExpr(random, 4, 3);
            final var rhs = RandomUtils.generateExpr(random, 4, 3);
            assertThat(Trees.equal(lhs, lhs)).isTrue();
            assertThat(Trees.equal(lhs, rhs)).isEqualTo(Trees.equal(rhs, lhs));
            if (Trees.equal(lhs, rhs)) {
                assertThat(lhs.hashCode()).isEqualTo(rhs.hashCode());
            }
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void copiesAreEqualButNotIdentical(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 100; i += 1) {
            final var expr = RandomUtils.generateExpr(random, 5, 4);
            final var copy = deepCopy(expr);
            assertThat(Trees.equal(expr, copy)).isTrue();
            assertThat(Trees.equal(copy, expr)).isTrue();
            assertThat(expr.hashCode()).isEqualTo(copy.hashCode());
            assertThat(expr.contains(copy)).isTrue();
            assertThat(Trees.isNil(expr)).isEqualTo(Cons.nil().isEqualTo(expr));
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void everyElementIsContained(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 100; i += 1) {
            final var expr = RandomUtils.generateExpr(random, 4, 4);
            if (!(expr instanceof Cons list)) {
                continue;
            }
            for (final var element : list) {
                assertThat(list.contains(element)).isTrue();
                if (element instanceof Cons subList) {
                    for (final var nested : subList) {
                        assertThat(list.contains(nested)).isTrue();
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void lengthFollowsRestChain(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 100; i += 1) {
            final var expr = RandomUtils.generateExpr(random, 3, 6);
            if (!(expr instanceof Cons list)) {
                continue;
            }
            final var expected = list.isNil() ? 0 : 1 + Trees.cdr(list).length();
            assertThat(list.length()).isEqualTo(expected);
            final var tailItems = new ArrayList<Expr>();
            for (int index = 1; index < list.length(); index += 1) {
                tailItems.add(list.item(index));
            }
            if (list.isCons()) {
                assertThat(list.tail()).containsExactlyElementsOf(tailItems);
            }
            assertThat(list.map(element -> element).isEqualTo(list)).isTrue();
        }
    }

    private static Expr deepCopy(final Expr expr) {
        if (expr instanceof Cons list) {
            return list.map(EqualityTest::deepCopy);
        }
        return new TestAtom(((TestAtom) expr).value());
    }
}
