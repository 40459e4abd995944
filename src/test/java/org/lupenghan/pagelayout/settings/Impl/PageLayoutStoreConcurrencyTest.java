package org.lupenghan.pagelayout.settings.Impl;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;
import org.lupenghan.pagelayout.page.models.PageId;
import org.lupenghan.pagelayout.settings.models.Params;

import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * 多线程同时读写存储，结束后检查索引一致性
 */
public class PageLayoutStoreConcurrencyTest {
    private static final int WRITERS = 8;
    private static final int READERS = 4;
    private static final int PAGES_PER_WRITER = 25;
    private static final int OPS_PER_THREAD = 2000;

    private PageLayoutStoreImpl store;
    private ExecutorService executor;

    @Before
    public void setUp() {
        store = new PageLayoutStoreImpl();
        executor = Executors.newFixedThreadPool(WRITERS + READERS);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testConcurrentWritersAndReaders() throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(WRITERS + READERS);
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (int w = 0; w < WRITERS; w++) {
            final int writer = w;
            executor.submit(() -> {
                try {
                    start.await();
                    Random random = new Random(writer);
                    for (int i = 0; i < OPS_PER_THREAD; i++) {
                        PageId p = new PageId("writer_" + writer + ".tif", random.nextInt(PAGES_PER_WRITER));
                        switch (random.nextInt(3)) {
                            case 0 -> store.setHardMarginsMM(p, new Margins(random.nextInt(20),
                                    random.nextInt(20), random.nextInt(20), random.nextInt(20)));
                            case 1 -> store.setContentZone(p, RectF.EMPTY,
                                    new SizeF(random.nextInt(300), random.nextInt(300)));
                            default -> store.setPageAlignment(p,
                                    new Alignment(Alignment.Vertical.TOP, Alignment.Horizontal.RIGHT));
                        }
                    }
                } catch (Throwable t) {
                    errors.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        for (int r = 0; r < READERS; r++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < OPS_PER_THREAD; i++) {
                        PageId widest = store.findWidestPage();
                        if (!widest.isNull()) {
                            // 条目不会被删除，找到的页面必然可以读到
                            assertTrue(store.getPageParams(widest).isPresent());
                            SizeF whatIf = store.getAggregateHardSizeMM(widest, new SizeF(1, 1));
                            assertTrue(whatIf.getWidth() >= 0 && whatIf.getHeight() >= 0);
                        }
                        SizeF aggregate = store.getAggregateHardSizeMM();
                        assertTrue(aggregate.getWidth() >= 0 && aggregate.getHeight() >= 0);
                    }
                } catch (Throwable t) {
                    errors.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue("workers did not finish in time", done.await(60, TimeUnit.SECONDS));
        assertTrue("Some threads encountered exceptions: " + errors, errors.isEmpty());

        int pages = store.size();
        assertTrue(pages > 0 && pages <= WRITERS * PAGES_PER_WRITER);
        PageLayoutStoreImplTest.assertOrdersConsistent(store, pages);

        double maxWidth = 0;
        double maxHeight = 0;
        for (int w = 0; w < WRITERS; w++) {
            for (int n = 0; n < PAGES_PER_WRITER; n++) {
                Params params = store.getPageParams(new PageId("writer_" + w + ".tif", n)).orElse(null);
                if (params == null) {
                    continue;
                }
                maxWidth = Math.max(maxWidth,
                        params.getContentSizeMM().getWidth() + params.getHardMarginsMM().horizontal());
                maxHeight = Math.max(maxHeight,
                        params.getContentSizeMM().getHeight() + params.getHardMarginsMM().vertical());
            }
        }
        assertEquals(new SizeF(maxWidth, maxHeight), store.getAggregateHardSizeMM());
    }
}
