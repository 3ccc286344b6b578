package com.tyron.filepicker.core.thumbnails;

import com.tyron.filepicker.api.thumbnails.RgbaImage;
import com.tyron.filepicker.api.thumbnails.ThumbnailRenderer;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class ThumbnailCacheTest {

    private static Path img(int i) {
        return Path.of("/pics/img" + i + ".png");
    }

    @Test
    public void newRequestsAreLimitedPerFrame() {
        ThumbnailCache cache = new ThumbnailCache(100, 2);
        cache.beginFrame();

        Assertions.assertTrue(cache.request(img(1), 64));
        Assertions.assertTrue(cache.request(img(2), 64));
        Assertions.assertFalse(cache.request(img(3), 64));
        Assertions.assertTrue(cache.request(img(1), 64), "known entries do not use the budget");
        Assertions.assertEquals(2, cache.takeRequests().size());
        Assertions.assertTrue(cache.takeRequests().isEmpty());

        cache.beginFrame();
        Assertions.assertTrue(cache.request(img(3), 64));
        Assertions.assertEquals(List.of(new ThumbnailRequest(img(3), 64)), cache.takeRequests());
    }

    @Test
    public void leastRecentlyUsedIsEvictedAndDestroyed() {
        ThumbnailCache cache = new ThumbnailCache(2, 10);
        cache.beginFrame();
        cache.request(img(1), 64);
        cache.request(img(2), 64);
        cache.fulfill(img(1), 11);
        cache.fulfill(img(2), 22);

        cache.request(img(1), 64);
        cache.request(img(3), 64);

        Assertions.assertEquals(2, cache.size());
        Assertions.assertNull(cache.state(img(2)));
        Assertions.assertEquals(11, cache.texture(img(1)).getAsLong());
        Assertions.assertArrayEquals(new long[]{22}, cache.takePendingDestroys());
        Assertions.assertEquals(0, cache.takePendingDestroys().length);
    }

    @Test
    public void lateUploadForEvictedEntryIsDestroyed() {
        ThumbnailCache cache = new ThumbnailCache(1, 10);
        cache.beginFrame();
        cache.request(img(1), 64);
        cache.request(img(2), 64);

        Assertions.assertEquals(List.of(new ThumbnailRequest(img(2), 64)), cache.takeRequests());

        cache.fulfill(img(1), 5);
        Assertions.assertArrayEquals(new long[]{5}, cache.takePendingDestroys());
    }

    @Test
    public void pumpDecodesUploadsAndDestroys() {
        ThumbnailCache cache = new ThumbnailCache(10, 10);
        cache.beginFrame();
        cache.request(img(1), 32);
        cache.request(img(2), 32);

        LongArrayList destroyed = new LongArrayList();
        ThumbnailRenderer renderer = new ThumbnailRenderer() {
            private long next = 100;

            @Override
            public long upload(RgbaImage image) {
                return next++;
            }

            @Override
            public void destroy(long textureId) {
                destroyed.add(textureId);
            }
        };
        cache.pump((path, maxSize) -> {
            if (path.equals(img(2))) {
                throw new IOException("corrupt");
            }
            return new RgbaImage(1, 1, new byte[4]);
        }, renderer);

        Assertions.assertEquals(ThumbnailCache.State.READY, cache.state(img(1)));
        Assertions.assertEquals(100, cache.texture(img(1)).getAsLong());
        Assertions.assertEquals(ThumbnailCache.State.FAILED, cache.state(img(2)));
        Assertions.assertTrue(cache.texture(img(2)).isEmpty());

        cache.clear();
        cache.pump((path, maxSize) -> new RgbaImage(1, 1, new byte[4]), renderer);
        Assertions.assertEquals(LongArrayList.wrap(new long[]{100}), destroyed);
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    public void rejectsNonPositiveLimits() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ThumbnailCache(0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ThumbnailCache(1, 0));
    }
}
