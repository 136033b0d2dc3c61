package io.formengine.core.ast.id;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeIdGeneratorTest {

    @Nested
    class NextTest {

        @Test
        void shouldPrefixIdsWithCategory() {
            // Given
            NodeIdGenerator generator = new NodeIdGenerator();

            // When
            String ast = generator.next(NodeIdCategory.COMPILE_AST);
            String pseudo = generator.next(NodeIdCategory.COMPILE_PSEUDO);
            String runtime = generator.next(NodeIdCategory.RUNTIME_PSEUDO);

            // Then
            assertThat(ast).isEqualTo("compile_ast:1");
            assertThat(pseudo).isEqualTo("compile_pseudo:1");
            assertThat(runtime).isEqualTo("runtime_pseudo:1");
        }

        @Test
        void shouldCountEachCategoryIndependently() {
            // Given
            NodeIdGenerator generator = new NodeIdGenerator();

            // When
            generator.next(NodeIdCategory.COMPILE_AST);
            generator.next(NodeIdCategory.COMPILE_AST);
            String pseudo = generator.next(NodeIdCategory.COMPILE_PSEUDO);

            // Then
            assertThat(pseudo).isEqualTo("compile_pseudo:1");
            assertThat(generator.issued(NodeIdCategory.COMPILE_AST)).isEqualTo(2);
            assertThat(generator.issued(NodeIdCategory.RUNTIME_AST)).isZero();
        }

        @Test
        void shouldNeverRepeatIdsUnderConcurrentUse() throws Exception {
            // Given
            NodeIdGenerator generator = new NodeIdGenerator();
            Set<String> ids = ConcurrentHashMap.newKeySet();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            // When
            for (int t = 0; t < 8; t++) {
                futures.add(
                        executor.submit(
                                () -> {
                                    start.await();
                                    for (int i = 0; i < 1000; i++) {
                                        ids.add(generator.next(NodeIdCategory.RUNTIME_PSEUDO));
                                    }
                                    return null;
                                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Then
            assertThat(ids).hasSize(8000);
        }
    }

    @Nested
    class CategoryTest {

        @Test
        void shouldRecoverCategoryFromId() {
            assertThat(NodeIdCategory.fromId("compile_ast:12"))
                    .contains(NodeIdCategory.COMPILE_AST);
            assertThat(NodeIdCategory.fromId("runtime_pseudo:3"))
                    .contains(NodeIdCategory.RUNTIME_PSEUDO);
        }

        @Test
        void shouldReturnEmptyForForeignIds() {
            assertThat(NodeIdCategory.fromId("node-1")).isEmpty();
            assertThat(NodeIdCategory.fromId("other:1")).isEmpty();
            assertThat(NodeIdCategory.fromId(null)).isEmpty();
        }

        @Test
        void shouldFlagRuntimeCategories() {
            assertThat(NodeIdCategory.RUNTIME_AST.isRuntime()).isTrue();
            assertThat(NodeIdCategory.RUNTIME_PSEUDO.isRuntime()).isTrue();
            assertThat(NodeIdCategory.COMPILE_AST.isRuntime()).isFalse();
        }
    }
}
