package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentAccessException;
import com.composum.platform.remap.ContentRepository;
import com.composum.platform.remap.LayoutFieldKind;
import com.composum.platform.remap.layout.XmlLayoutFormat;
import com.composum.platform.remap.logging.MessageContainer;
import com.composum.platform.remap.testing.testutil.ErrorCollectorAlwaysPrintingFailures;
import com.composum.platform.remap.testutil.InMemoryContentRepository;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import static com.composum.platform.remap.testing.testutil.LayoutMatchers.hasDatasource;
import static com.composum.platform.remap.testutil.LayoutFixtures.finalLayout;
import static com.composum.platform.remap.testutil.LayoutFixtures.layout;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class LayoutRewriterTest {

    @Rule
    public final ErrorCollectorAlwaysPrintingFailures ec = new ErrorCollectorAlwaysPrintingFailures();

    protected InMemoryContentRepository repository;

    protected LayoutRewriter rewriter;

    protected RemapTask task;

    @Before
    public void setup() {
        repository = new InMemoryContentRepository();
        rewriter = new LayoutRewriter(repository, new PathCorrelator(repository), new XmlLayoutFormat());
        repository.node("/A", "A1");
        repository.node("/A/x", "X1").shared(layout("Y1")).version("en", 1, finalLayout("Y1"));
        repository.node("/A/x/y", "Y1").version("en", 1, null);
        repository.node("/B", "B1");
        repository.node("/B/x", "X2").shared(layout("Y1")).version("en", 1, finalLayout("Y1"));
        repository.node("/B/x/y", "Y2").version("en", 1, null);
        task = new RemapTask(repository.get("/A"), repository.get("/B"), new MessageContainer());
    }

    /** The set of rewritten shared layouts belongs to the task: a second pass of the same task leaves them alone. */
    @Test
    public void sharedLayoutIsOnlyRewrittenOncePerTask() throws ContentAccessException {
        rewriter.rewriteNodeLayouts(task, repository.get("/A/x"));
        ec.checkThat(repository.sharedLayout("/B/x"), hasDatasource("Y2"));
        ec.checkThat(repository.finalLayout("/B/x", "en", 1), hasDatasource("Y2"));

        try (ContentRepository.FieldEdit edit = repository.edit(repository.get("/B/x"))) {
            edit.set(LayoutFieldKind.SHARED, layout("Q1"));
            edit.set(LayoutFieldKind.FINAL, finalLayout("Q1"));
            edit.commit();
        }
        rewriter.rewriteNodeLayouts(task, repository.get("/A/x"));

        ec.checkThat(repository.sharedLayout("/B/x"), hasDatasource("Q1"));
        ec.checkThat(repository.finalLayout("/B/x", "en", 1), hasDatasource("Y2"));
        ec.checkThat(task.getChangedFields(), is(3));
    }

    @Test
    public void unparseableLayoutIsIgnoredSilently() {
        repository.node("/A/w", "W1").shared("<r><d>broken").version("en", 1, "  ");
        repository.node("/B/w", "W2").shared("<r><d>broken").version("en", 1, "  ");

        rewriter.rewriteNodeLayouts(task, repository.get("/A/w"));

        ec.checkThat(repository.getCommittedEdits(), hasSize(0));
        ec.checkThat(task.getMessages().isEmpty(), is(true));
    }

    @Test
    public void selfReferenceIsKept() {
        repository.node("/A/s", "S1").shared(layout("S1")).version("en", 1, null);
        repository.node("/B/s", "S2").shared(layout("S1")).version("en", 1, null);

        rewriter.rewriteNodeLayouts(task, repository.get("/A/s"));

        ec.checkThat(repository.sharedLayout("/B/s"), hasDatasource("S1"));
        ec.checkThat(task.getMessages().isEmpty(), is(true));
    }

}
