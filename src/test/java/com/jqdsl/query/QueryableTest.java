package com.jqdsl.query;

import com.jqdsl.json.DocumentParser;
import com.jqdsl.tree.Branch;
import com.jqdsl.tree.Leaf;
import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.Tree;
import com.jqdsl.tree.TreeBuilder;
import org.eclipse.collections.impl.tuple.Tuples;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.jqdsl.bool.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

public class QueryableTest {

    private static final String PODS = "{\"pods\": ["
            + "{\"name\": \"a\", \"status\": {\"ready\": true, \"restarts\": 3}},"
            + "{\"name\": \"b\", \"status\": {\"ready\": false, \"restarts\": 0}}]}";

    private static final String NESTED = "{\"a\": {\"x\": 1, \"b\": {\"x\": 2, \"c\": {\"x\": 3}}}, \"x\": 0}";

    private Queryable load(String json) throws IOException {
        return load(json, null);
    }

    private Queryable load(String json, String source) throws IOException {
        DocumentParser parser = new DocumentParser();
        return Queryable.of(TreeBuilder.build(
                parser.parse(json.getBytes(StandardCharsets.UTF_8), DocumentParser.Format.JSON), "conf", source));
    }

    private List<String> names(Queryable result) {
        List<String> names = new ArrayList<>();
        for (Tree node : result.nodes()) {
            names.add(node.name());
        }
        return names;
    }

    // ============================================================
    // Scenarios
    // ============================================================

    @Test
    public void testPodsWhereAndSelect() throws IOException {
        Queryable conf = load(PODS);

        Queryable notReady = conf.get("pods")
                .where(pod -> Scalars.equal(pod.get("status").get("ready").value(), false));
        assertEquals(1, notReady.size());
        assertEquals("b", notReady.get("name").value());

        Queryable records = notReady.select(pod -> List.of(pod.get("name"), pod.get("status").get("restarts")));
        assertEquals(1, records.size());
        assertEquals(List.of("name", "restarts"), records.keys().castToList());
        assertEquals("b", records.get("name").value());
        assertEquals(0L, records.get("restarts").value());
    }

    @Test
    public void testKeysOfRoot() throws IOException {
        Queryable conf = load("{\"b\": {\"c\": 2}, \"a\": 1}");

        assertEquals(List.of("a", "b"), conf.keys().castToList());
    }

    @Test
    public void testKeysDeduplicateAcrossParents() throws IOException {
        Queryable conf = load(PODS);

        assertEquals(List.of("name", "status"), conf.get("pods").keys().castToList());
    }

    @Test
    public void testCrumbsDown() throws IOException {
        Queryable conf = load("{\"a\": {\"b\": 1}}");

        assertEquals(List.of("a.b"), conf.crumbs(true).castToList());
    }

    @Test
    public void testCrumbsDownFromInnerNodes() throws IOException {
        Queryable conf = load(PODS);

        assertEquals(List.of("name", "status.ready", "status.restarts"),
                conf.get("pods").crumbs(true).castToList());
    }

    @Test
    public void testCrumbsUp() throws IOException {
        Queryable conf = load("{\"labels\": {\"app.kubernetes.io/name\": \"web\", \"tier\": \"front\"}}");

        assertEquals(List.of("conf.labels.tier", "conf.labels[\"app.kubernetes.io/name\"]"),
                conf.get("labels").leaves().crumbs().castToList());
        assertEquals(List.of("conf.labels"), conf.get("labels").crumbs().castToList());
    }

    // ============================================================
    // Selection
    // ============================================================

    @Test
    public void testDescendKeepsParentThenChildOrder() throws IOException {
        Queryable conf = load(PODS);

        Queryable names = conf.get("pods").get("name");
        assertEquals(2, names.size());
        assertEquals(List.of("a", "b"), List.of(names.get(0).value(), names.get(1).value()));
    }

    @Test
    public void testDescendWithTupleAndPredicate() throws IOException {
        Queryable conf = load(PODS);

        assertEquals(1, conf.find(Query.of("restarts", gt(0))).size());
        assertEquals(2, conf.get("pods").get(startswith("st")).size());
        assertEquals(0, conf.get("missing").size());
    }

    @Test
    public void testPositionalIndexing() throws IOException {
        Queryable pods = load(PODS).get("pods");

        assertEquals("a", pods.get(0).get("name").value());
        assertEquals("b", pods.get(-1).get("name").value());
        assertEquals(1, pods.slice(1, 5).size());
        assertEquals(2, pods.slice(0, 2).size());
        assertEquals(0, pods.slice(2, 1).size());
        assertThrows(IndexOutOfBoundsException.class, () -> pods.get(2));
    }

    @Test
    public void testFindMatchesLevelByLevelQuery() throws IOException {
        Queryable conf = load(NESTED);

        Queryable found = conf.find("x");
        Queryable byHand = conf.get("x")
                .plus(conf.get("a").get("x"))
                .plus(conf.get("a").get("b").get("x"))
                .plus(conf.get("a").get("b").get("c").get("x"));

        assertEquals(4, found.size());
        assertEquals(byHand.values(), found.values());
        assertEquals(List.of(0L, 1L, 2L, 3L), found.values().castToList());
    }

    @Test
    public void testFindChainsQueries() throws IOException {
        Queryable conf = load(NESTED);

        assertEquals(List.of(2L), conf.find("b", "x").values().castToList());
        assertEquals(List.of(3L), conf.find("b", "c", "x").values().castToList());
        assertEquals(0, conf.find("x", "b").size());
    }

    @Test
    public void testWhereWithBool() throws IOException {
        Queryable pods = load(PODS).get("pods");

        assertEquals(List.of("b"), List.of(pods.where(Query.q("name", "b")).get("name").value()));
        assertEquals(2, pods.where(Query.q("status")).size());
        assertEquals(0, pods.get("name").where(Query.q(Query.ALL)).size());
    }

    @Test
    public void testWhereExcludesFailingNodes() throws IOException {
        Queryable pods = load(PODS).get("pods");

        // the first pod has no "missing" child, so value() throws for it
        Queryable result = pods.where(pod -> pod.get("missing").value() != null);
        assertTrue(result.isEmpty());
    }

    @Test
    public void testUpto() throws IOException {
        Queryable conf = load(NESTED);

        Queryable result = conf.find("x").upto("b");
        assertEquals(List.of("b"), names(result));
        assertEquals(0, conf.upto(Query.ALL).size());
    }

    @Test
    public void testParentsAndRoots() throws IOException {
        Queryable conf = load(NESTED);

        Queryable xs = conf.find("x");
        assertEquals(List.of("conf", "a", "b", "c"), names(xs.parents()));
        assertEquals(List.of("conf"), names(xs.roots()));
        assertTrue(conf.roots().isEmpty());
        assertTrue(conf.parents().isEmpty());
    }

    @Test
    public void testBranchesAndLeaves() throws IOException {
        Queryable conf = load(NESTED);

        assertEquals(List.of("a"), names(conf.branches()));
        assertEquals(List.of("x"), names(conf.leaves()));
        assertEquals(List.of("a", "x"), names(conf.children()));
    }

    // ============================================================
    // Values
    // ============================================================

    @Test
    public void testValueIsFirstInTraversalOrder() throws IOException {
        Queryable conf = load("{\"empty\": {}, \"ports\": [8080, 80]}");

        assertEquals(8080L, conf.children().value());
    }

    @Test
    public void testValueOnEmptyResultFails() throws IOException {
        Queryable conf = load(PODS);

        assertThrows(EmptyResultException.class, () -> conf.get("missing").value());
        assertThrows(EmptyResultException.class, () -> conf.get("pods").value());
    }

    @Test
    public void testValuesAndUniqueValues() throws IOException {
        Queryable conf = load("{\"a\": [3, 1, 3], \"b\": 2}");

        assertEquals(List.of(1L, 2L, 3L, 3L), conf.children().values().castToList());
        assertEquals(List.of(1L, 2L, 3L), conf.children().uniqueValues().castToList());
    }

    @Test
    public void testMostCommon() throws IOException {
        Queryable conf = load("{\"tags\": [\"x\", \"y\", \"x\", \"z\", \"y\", \"x\"], \"other\": [\"z\"]}");

        assertEquals(List.of(Tuples.pair("x", 3), Tuples.pair("y", 2), Tuples.pair("z", 2)),
                conf.children().mostCommon().castToList());
        assertEquals(List.of(Tuples.pair("x", 3)), conf.children().mostCommon(1).castToList());
    }

    @Test
    public void testMostCommonCountsEqualNumbersTogether() throws IOException {
        Queryable conf = load("{\"a\": [1, 2.5], \"b\": [1.0, 2.50, 1]}");

        assertEquals(List.of(Tuples.pair(1L, 3), Tuples.pair(2.5, 2)),
                conf.children().mostCommon().castToList());
    }

    @Test
    public void testSources() throws IOException {
        Queryable conf = load(PODS, "b.json").plus(load(PODS, "a.json")).plus(load(PODS));

        assertEquals(List.of("a.json", "b.json"), conf.find("restarts").sources().castToList());
    }

    // ============================================================
    // Reshaping
    // ============================================================

    @Test
    public void testOrderByIsStable() throws IOException {
        Queryable items = load("{\"items\": [{\"name\": \"a\", \"r\": 3}, {\"name\": \"b\", \"r\": 1},"
                + " {\"name\": \"c\", \"r\": 3}]}").get("items");

        assertEquals(List.of("b", "a", "c"), itemNames(items.orderBy(i -> i.get("r"))));
        assertEquals(List.of("a", "c", "b"), itemNames(items.orderBy(i -> i.get("r"), true)));
        assertEquals(List.of("a", "b", "c"), itemNames(items.orderBy(i -> Queryable.empty())));
        assertEquals(List.of("c", "a", "b"), itemNames(items.orderBy(i -> List.of(i.get("r"), i.get("name")), true)));
    }

    private List<Object> itemNames(Queryable items) {
        List<Object> names = new ArrayList<>();
        for (Queryable item : items) {
            names.add(item.get("name").value());
        }
        return names;
    }

    @Test
    public void testSelectRenamesNamedEntries() throws IOException {
        Queryable pods = load(PODS).get("pods");

        Queryable records = pods.select(pod -> List.of(Map.of("pod", pod.get("name")), Map.of("state", pod.get("status"))));
        assertEquals(2, records.size());
        assertEquals(List.of("pod", "state"), records.keys().castToList());
        assertTrue(records.get("state").nodes().getFirst() instanceof Branch);
        assertTrue(records.get("pod").nodes().getFirst() instanceof Leaf);
        assertEquals(List.of(false, true), records.get("state").get("ready").values().castToList());
    }

    @Test
    public void testSelectFlattensEarlierRecords() throws IOException {
        Queryable pods = load(PODS).get("pods");

        Queryable records = pods.select(pod -> pod.get("name"));
        Queryable again = records.select(record -> record);
        assertEquals(2, again.size());
        assertEquals(List.of("name"), again.keys().castToList());
        assertNull(again.nodes().getFirst().parent());
    }

    @Test
    public void testSelectOmitsEmptyAndFailingRecords() throws IOException {
        Queryable pods = load(PODS).get("pods");

        assertTrue(pods.select(pod -> pod.get("missing")).isEmpty());
        Queryable records = pods.select(pod -> "b".equals(pod.get("name").value()) ? "not a result" : pod.get("name"));
        assertEquals(1, records.size());
        assertEquals("a", records.get("name").value());
    }

    // ============================================================
    // Combining and consumption
    // ============================================================

    @Test
    public void testPlusAndExtend() throws IOException {
        Queryable left = load(PODS).get("pods");
        Queryable right = load(NESTED).get("a");

        Queryable both = left.plus(right);
        assertEquals(List.of("pods", "pods", "a"), names(both));
        assertEquals(2, left.size());

        left.extend(right).extend(right);
        assertEquals(4, left.size());
    }

    @Test
    public void testIterationAndTruthiness() throws IOException {
        Queryable pods = load(PODS).get("pods");

        int count = 0;
        for (Queryable pod : pods) {
            assertEquals(1, pod.size());
            count++;
        }
        assertEquals(2, count);
        assertTrue(pods.notEmpty());
        assertTrue(Queryable.empty().isEmpty());
    }

    @Test
    public void testRendering() throws IOException {
        Queryable conf = load("{\"a\": 1, \"b\": {\"c\": \"x\"}}");

        assertEquals("\n[b]\n  c: \"x\"\n\n", conf.get("b").toString());
        assertEquals("a: 1\n", conf.get("a").toString());
    }
}
