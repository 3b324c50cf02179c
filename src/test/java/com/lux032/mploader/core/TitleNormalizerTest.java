package com.lux032.mploader.core;

import com.lux032.mploader.model.NormalizedQuery;
import com.lux032.mploader.model.SourceItem;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TitleNormalizerTest {

    private final TitleNormalizer normalizer = new TitleNormalizer();

    @Test
    public void testNoiseGroupRemovedAndFeaturingExtracted() {
        NormalizedQuery query = normalizer.normalize("Shape of You [Official Video] ft. Stormzy", "Ed Sheeran");

        Assertions.assertEquals("Shape of You", query.getSearchTitle());
        Assertions.assertEquals("Ed Sheeran", query.getArtistHint());
        Assertions.assertEquals("Stormzy", query.getFeaturedArtist());
        Assertions.assertEquals(List.of("Ed Sheeran", "Stormzy"), query.getHints());
    }

    @Test
    public void testBracketedFeaturingAndTopicChannel() {
        NormalizedQuery query = normalizer.normalize("Song Name (feat. Artist B) [Lyrics]", "ArtistA - Topic");

        Assertions.assertEquals("Song Name", query.getSearchTitle());
        Assertions.assertEquals("ArtistA", query.getArtistHint());
        Assertions.assertEquals("Artist B", query.getFeaturedArtist());
    }

    @Test
    public void testHyphenatedFeaturedArtistKeptWhole() {
        NormalizedQuery jayZ = normalizer.normalize("Empire State of Mind ft. Jay-Z", "Alicia Keys");
        Assertions.assertEquals("Empire State of Mind", jayZ.getSearchTitle());
        Assertions.assertEquals("Jay-Z", jayZ.getFeaturedArtist());

        NormalizedQuery aha = normalizer.normalize("Take On Me feat. A-ha (Official Video)", "Rhino");
        Assertions.assertEquals("Take On Me", aha.getSearchTitle());
        Assertions.assertEquals("A-ha", aha.getFeaturedArtist());

        NormalizedQuery tPain = normalizer.normalize("Low feat. T-Pain | Lyrics", "Flo Rida");
        Assertions.assertEquals("Low", tPain.getSearchTitle());
        Assertions.assertEquals("T-Pain", tPain.getFeaturedArtist());
    }

    @Test
    public void testInlineFeaturingStopsAtSpacedSeparator() {
        NormalizedQuery query = normalizer.normalize("Song ft. Jay-Z - Live at Wembley", "Artist");

        Assertions.assertEquals("Jay-Z", query.getFeaturedArtist());
        Assertions.assertEquals("Song - Live at Wembley", query.getSearchTitle());
    }

    @Test
    public void testNonNoiseBracketIsKept() {
        NormalizedQuery query = normalizer.normalize("Tum Hi Ho (From \"Aashiqui 2\")", "T-Series");

        Assertions.assertEquals("Tum Hi Ho (From \"Aashiqui 2\")", query.getSearchTitle());
        Assertions.assertEquals("T-Series", query.getArtistHint());
        Assertions.assertNull(query.getFeaturedArtist());
    }

    @Test
    public void testEverythingAfterPipeDropped() {
        NormalizedQuery query = normalizer.normalize("Kesariya | Brahmastra | Arijit Singh", "Sony Music India");

        Assertions.assertEquals("Kesariya", query.getSearchTitle());
    }

    @Test
    public void testBareQualityTagRemoved() {
        Assertions.assertEquals("Believer", normalizer.normalize("Believer HD", null).getSearchTitle());
        Assertions.assertEquals("Believer", normalizer.normalize("Believer 4K", null).getSearchTitle());
    }

    @Test
    public void testFallsBackToRawTitleWhenNothingLeft() {
        NormalizedQuery query = normalizer.normalize("  [Official Video]  ", null);

        Assertions.assertEquals("[Official Video]", query.getSearchTitle());
    }

    @Test
    public void testNullTitleAndUploader() {
        NormalizedQuery query = normalizer.normalize(null, null);

        Assertions.assertEquals("", query.getSearchTitle());
        Assertions.assertNull(query.getArtistHint());
        Assertions.assertTrue(query.getHints().isEmpty());
    }

    @Test
    public void testChannelSuffixesStripped() {
        Assertions.assertEquals("EdSheeran", normalizer.cleanUploader("EdSheeranVEVO"));
        Assertions.assertEquals("Arijit Singh", normalizer.cleanUploader("Arijit Singh Official Channel"));
        Assertions.assertEquals("Imagine Dragons", normalizer.cleanUploader("Imagine Dragons - Topic"));
        Assertions.assertEquals("Zee", normalizer.cleanUploader("Zee Music"));
        Assertions.assertNull(normalizer.cleanUploader("   "));
    }

    @Test
    public void testSourceItemDurationCarried() {
        SourceItem item = new SourceItem("Believer (Audio)", "ImagineDragonsVEVO", "abc", 1, "https://y/abc", 204);

        NormalizedQuery query = normalizer.normalize(item);

        Assertions.assertEquals("Believer", query.getSearchTitle());
        Assertions.assertEquals("ImagineDragons", query.getArtistHint());
        Assertions.assertEquals(Integer.valueOf(204), query.getDurationSeconds());
    }

    @Test
    public void testSameInputSameOutput() {
        NormalizedQuery first = normalizer.normalize("Perfect (Official Music Video)", "Ed Sheeran");
        NormalizedQuery second = normalizer.normalize("Perfect (Official Music Video)", "Ed Sheeran");

        Assertions.assertEquals(first, second);
    }
}
