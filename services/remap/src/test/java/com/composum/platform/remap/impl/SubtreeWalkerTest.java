package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.layout.XmlLayoutFormat;
import com.composum.platform.remap.logging.MessageContainer;
import com.composum.platform.remap.testing.testutil.ErrorCollectorAlwaysPrintingFailures;
import com.composum.platform.remap.testutil.InMemoryContentRepository;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class SubtreeWalkerTest {

    @Rule
    public final ErrorCollectorAlwaysPrintingFailures ec = new ErrorCollectorAlwaysPrintingFailures();

    protected InMemoryContentRepository repository;

    protected final List<String> visited = new ArrayList<>();

    /** Aborts the task when visiting this path. */
    protected String abortAt;

    protected SubtreeWalker walker;

    @Before
    public void setup() {
        repository = new InMemoryContentRepository();
        repository.node("/A", "A1")
                .child("a", "a1").child("aa", "aa1");
        repository.node("/A/a/ab", "ab1");
        repository.node("/A/b", "b1").child("ba", "ba1");
        repository.node("/B", "B1");
        LayoutRewriter recorder = new LayoutRewriter(repository, new PathCorrelator(repository), new XmlLayoutFormat()) {
            @Override
            public void rewriteNodeLayouts(@Nonnull RemapTask task, @Nonnull ContentNode node) {
                visited.add(node.getPath());
                if (node.getPath().equals(abortAt)) {
                    task.abort();
                }
            }
        };
        walker = new SubtreeWalker(repository, recorder);
    }

    protected RemapTask newTask() {
        return new RemapTask(repository.get("/A"), repository.get("/B"), new MessageContainer());
    }

    @Test
    public void visitsEachNodeBeforeItsChildren() {
        RemapTask task = newTask();
        walker.walk(task);
        ec.checkThat(visited, contains("/A", "/A/a", "/A/a/aa", "/A/a/ab", "/A/b", "/A/b/ba"));
        ec.checkThat(task.getVisitedNodes(), is(6));
    }

    @Test
    public void stopsWhenAborted() {
        abortAt = "/A/a/aa";
        RemapTask task = newTask();
        walker.walk(task);
        ec.checkThat(visited, contains("/A", "/A/a", "/A/a/aa"));
        ec.checkThat(task.isAborted(), is(true));
        ec.checkThat(task.getVisitedNodes(), is(3));
    }

}
