package com.mixtape.playlist.infrastructure.resolver;

import com.mixtape.playlist.core.exception.ResolutionFailedException;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackKind;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlResolverAdapterTest {

    private final UrlResolverAdapter resolver = new UrlResolverAdapter();

    @TempDir
    Path musicDir;

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private Path touch(String relative) throws IOException {
        Path file = musicDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{0});
        return file;
    }

    private static List<String> titles(List<TrackEntry> entries) {
        return entries.stream().map(TrackEntry::getTitle).toList();
    }

    // ========================================================================

    @Test
    @DisplayName("Stream URLs become a single entry named after the path")
    void streamUrl() {
        List<TrackEntry> entries = resolver.resolve(URI.create("http://radio.example/channels/jazz.ogg"));

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getKind()).isEqualTo(TrackKind.URL);
        assertThat(entries.get(0).getTitle()).isEqualTo("jazz.ogg");
        assertThat(entries.get(0).getStaticMetadata().url()).isEqualTo("http://radio.example/channels/jazz.ogg");
    }

    @Test
    @DisplayName("A stream without a path is named after its host")
    void streamWithoutPath() {
        List<TrackEntry> entries = resolver.resolve(URI.create("https://live.example"));

        assertThat(entries.get(0).getTitle()).isEqualTo("live.example");
    }

    @Test
    @DisplayName("Unsupported schemes are rejected")
    void unsupportedScheme() {
        assertThatThrownBy(() -> resolver.resolve(URI.create("gopher://old.example/track")))
                .isInstanceOf(ResolutionFailedException.class)
                .hasMessageContaining("Unsupported URL");
    }

    @Nested
    @DisplayName("Local files")
    class LocalFiles {

        @Test
        @DisplayName("An audio file is named after its base name")
        void audioFile() throws IOException {
            Path song = touch("Song One.flac");

            List<TrackEntry> entries = resolver.resolve(song.toUri());

            assertThat(titles(entries)).containsExactly("Song One");
            assertThat(entries.get(0).getStaticMetadata().url()).isEqualTo(song.toUri().toString());
        }

        @Test
        @DisplayName("A directory yields its audio files in path order")
        void directory() throws IOException {
            touch("b.mp3");
            touch("a.ogg");
            touch("cover.jpg");
            touch("disc2/c.flac");

            List<TrackEntry> entries = resolver.resolve(musicDir.toUri());

            assertThat(titles(entries)).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Missing files cannot be resolved")
        void missingFile() {
            URI missing = musicDir.resolve("nothing.mp3").toUri();

            assertThatThrownBy(() -> resolver.resolve(missing))
                    .isInstanceOf(ResolutionFailedException.class)
                    .extracting(ex -> ((ResolutionFailedException) ex).getSource())
                    .isEqualTo(missing.toString());
        }

        @Test
        @DisplayName("Files that are not audio are rejected")
        void notAudio() throws IOException {
            Path cover = touch("cover.jpg");

            assertThatThrownBy(() -> resolver.resolve(cover.toUri()))
                    .isInstanceOf(ResolutionFailedException.class);
        }
    }

    @Nested
    @DisplayName("M3U playlists")
    class M3u {

        @Test
        @DisplayName("EXTINF lines describe the entry that follows")
        void extinf() throws IOException {
            touch("one.mp3");
            touch("sub/two.mp3");
            Path list = musicDir.resolve("mix.m3u");
            Files.writeString(list, String.join("\n",
                    "\uFEFF#EXTM3U",
                    "#EXTINF:215,The Band - First Song",
                    "one.mp3",
                    "",
                    "#EXTINF:-1,Untitled",
                    "sub/two.mp3",
                    "#EXTINF:300,Radio - Live",
                    "http://radio.example/live"), StandardCharsets.UTF_8);

            List<TrackEntry> entries = resolver.resolve(list.toUri());

            assertThat(titles(entries)).containsExactly("First Song", "Untitled", "Live");
            TrackMetadata first = entries.get(0).getStaticMetadata();
            assertThat(first.artist()).isEqualTo("The Band");
            assertThat(first.lengthSeconds()).isEqualTo(215);
            assertThat(first.url()).isEqualTo(musicDir.resolve("one.mp3").toUri().toString());
            assertThat(entries.get(1).getStaticMetadata().lengthSeconds()).isZero();
            assertThat(entries.get(2).getStaticMetadata().url()).isEqualTo("http://radio.example/live");
        }

        @Test
        @DisplayName("Entries whose file is missing are kept but marked invalid")
        void missingEntry() throws IOException {
            touch("here.mp3");
            Path list = musicDir.resolve("list.m3u8");
            Files.writeString(list, "here.mp3\ngone.mp3\n", StandardCharsets.UTF_8);

            List<TrackEntry> entries = resolver.resolve(list.toUri());

            assertThat(titles(entries)).containsExactly("here", "gone");
            assertThat(entries.get(0).isValid()).isTrue();
            assertThat(entries.get(1).isValid()).isFalse();
        }
    }

    @Test
    @DisplayName("Availability is checked for local files only")
    void availability() throws IOException {
        Path song = touch("song.mp3");
        TrackEntry local = TrackEntry.url(TrackMetadata.of("song", "", "", 0, song.toUri().toString()));
        TrackEntry stream = TrackEntry.url(TrackMetadata.of("live", "", "", 0, "http://radio.example/live"));

        assertThat(resolver.isAvailable(local)).isTrue();
        assertThat(resolver.isAvailable(stream)).isTrue();

        Files.delete(song);
        assertThat(resolver.isAvailable(local)).isFalse();
    }

    @Test
    @DisplayName("A file URL without a path is rejected and reported unavailable")
    void opaqueFileUrl() {
        URI opaque = URI.create("file:song.mp3");

        assertThatThrownBy(() -> resolver.resolve(opaque))
                .isInstanceOf(ResolutionFailedException.class)
                .hasMessageContaining("Invalid file URL");
        assertThat(resolver.isAvailable(TrackEntry.url(TrackMetadata.of("Song", "", "", 0, opaque.toString()))))
                .isFalse();
    }
}
