package com.mixtape.playlist.infrastructure.resolver;

import com.mixtape.playlist.application.port.UrlResolverPort;
import com.mixtape.playlist.core.exception.ResolutionFailedException;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves stream URLs, local audio files, directories and M3U playlists into entries.
 * Stream URLs are taken as they are; nothing is fetched over the network.
 */
@Component
public class UrlResolverAdapter implements UrlResolverPort {

    private static final Logger log = LoggerFactory.getLogger(UrlResolverAdapter.class);

    private static final Set<String> STREAM_SCHEMES = Set.of("http", "https", "mms", "rtsp", "rtmp");
    private static final Set<String> AUDIO_EXTENSIONS =
            Set.of("mp3", "flac", "ogg", "oga", "opus", "m4a", "aac", "wav", "wma", "aiff", "ape", "mpc");
    private static final Set<String> PLAYLIST_EXTENSIONS = Set.of("m3u", "m3u8");

    private static final String EXTINF = "#EXTINF:";

    @Override
    public List<TrackEntry> resolve(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (STREAM_SCHEMES.contains(scheme)) {
            return List.of(stream(uri));
        }
        if (!"file".equals(scheme)) {
            throw new ResolutionFailedException(uri.toString(), "Unsupported URL: " + uri);
        }

        Path path;
        try {
            path = Path.of(uri);
        } catch (IllegalArgumentException ex) {
            throw new ResolutionFailedException(uri.toString(), "Invalid file URL: " + uri, ex);
        }
        if (!Files.exists(path)) {
            throw new ResolutionFailedException(uri.toString(), "No such file: " + path);
        }
        if (Files.isDirectory(path)) {
            return directory(path);
        }
        String extension = extension(path);
        if (PLAYLIST_EXTENSIONS.contains(extension)) {
            return playlistFile(path);
        }
        if (AUDIO_EXTENSIONS.contains(extension)) {
            return List.of(file(path, null, 0));
        }
        throw new ResolutionFailedException(uri.toString(), "Not an audio file: " + path);
    }

    @Override
    public boolean isAvailable(TrackEntry entry) {
        String url = entry.getStaticMetadata().url();
        if (url == null || !url.startsWith("file:")) {
            return true;
        }
        try {
            return Files.exists(Path.of(URI.create(url)));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private TrackEntry stream(URI uri) {
        String path = uri.getPath() == null ? "" : uri.getPath();
        String name = path.isEmpty() || "/".equals(path) ? uri.getHost() : path.substring(path.lastIndexOf('/') + 1);
        return TrackEntry.url(TrackMetadata.of(name, "", "", 0, uri.toString()));
    }

    private List<TrackEntry> directory(Path directory) {
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> AUDIO_EXTENSIONS.contains(extension(file)))
                    .sorted()
                    .map(file -> file(file, null, 0))
                    .toList();
        } catch (IOException | UncheckedIOException ex) {
            throw new ResolutionFailedException(directory.toUri().toString(), "Cannot read directory " + directory, ex);
        }
    }

    /**
     * Reads an M3U/M3U8 list. {@code #EXTINF:length,Artist - Title} lines describe the entry that follows;
     * relative entries are resolved against the list's directory.
     */
    private List<TrackEntry> playlistFile(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ResolutionFailedException(file.toUri().toString(), "Cannot read playlist " + file, ex);
        }

        List<TrackEntry> entries = new ArrayList<>();
        String info = null;
        for (String raw : lines) {
            String line = raw.strip();
            if (line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(EXTINF)) {
                info = line.substring(EXTINF.length());
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }
            TrackEntry entry = playlistLine(file, line, info);
            if (entry != null) {
                entries.add(entry);
            }
            info = null;
        }
        log.debug("Read {} entries from {}", entries.size(), file);
        return entries;
    }

    private TrackEntry playlistLine(Path playlist, String line, String info) {
        int length = 0;
        String artist = "";
        String title = null;
        if (info != null) {
            int comma = info.indexOf(',');
            String lengthPart = comma < 0 ? info : info.substring(0, comma);
            try {
                length = Math.max(0, Integer.parseInt(lengthPart.trim()));
            } catch (NumberFormatException ex) {
                length = 0;
            }
            if (comma >= 0) {
                String description = info.substring(comma + 1).trim();
                int dash = description.indexOf(" - ");
                if (dash >= 0) {
                    artist = description.substring(0, dash).trim();
                    title = description.substring(dash + 3).trim();
                } else {
                    title = description;
                }
            }
        }

        if (line.contains("://")) {
            URI uri;
            try {
                uri = URI.create(line);
            } catch (IllegalArgumentException ex) {
                log.debug("Skipping unreadable playlist line '{}' in {}", line, playlist);
                return null;
            }
            if (title == null) {
                return stream(uri);
            }
            return TrackEntry.url(TrackMetadata.of(title, artist, "", length, uri.toString()));
        }

        Path path;
        try {
            Path parent = playlist.toAbsolutePath().getParent();
            path = parent == null ? Path.of(line) : parent.resolve(line).normalize();
        } catch (InvalidPathException ex) {
            log.debug("Skipping unreadable playlist line '{}' in {}", line, playlist);
            return null;
        }
        TrackEntry entry = file(path, title, length);
        if (!artist.isEmpty()) {
            TrackMetadata metadata = entry.getStaticMetadata();
            entry = entry.withMetadata(TrackMetadata.of(metadata.title(), artist, "", length, metadata.url()));
        }
        return Files.exists(path) ? entry : entry.withValid(false);
    }

    private TrackEntry file(Path path, String title, int length) {
        String name = title != null ? title : baseName(path);
        return TrackEntry.url(TrackMetadata.of(name, "", "", length, path.toUri().toString()));
    }

    private static String baseName(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
