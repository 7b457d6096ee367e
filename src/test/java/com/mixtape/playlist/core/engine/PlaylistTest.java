package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.exception.OutOfRangeException;
import com.mixtape.playlist.core.model.PlaylistSnapshot;
import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;
import com.mixtape.playlist.core.model.SortField;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaylistTest {

    private Playlist playlist;
    private Recorder recorder;

    @BeforeEach
    void setUp() {
        playlist = newPlaylist("main", new EngineSettings(100, 5, 15, false));
        recorder = new Recorder();
        playlist.addListener(recorder);
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static Playlist newPlaylist(String id, EngineSettings settings) {
        return new Playlist(id, settings, BackgroundTasks.inline(), new Random(7));
    }

    private static TrackEntry track(String title) {
        return TrackEntry.url(TrackMetadata.of(title, "Artist", "Album", 100, "file:///music/" + title + ".mp3"));
    }

    private static TrackEntry stream(String title, String url) {
        return TrackEntry.url(TrackMetadata.of(title, "", "", 0, url));
    }

    private static List<TrackEntry> tracks(String... titles) {
        List<TrackEntry> entries = new ArrayList<>();
        for (String title : titles) {
            entries.add(track(title));
        }
        return entries;
    }

    private void fill(String... titles) {
        playlist.insertItems(tracks(titles));
        recorder.events.clear();
    }

    private List<String> titles() {
        return titles(playlist);
    }

    private static List<String> titles(Playlist playlist) {
        return playlist.items().stream().map(TrackEntry::getTitle).toList();
    }

    private static InsertVetoListener vetoTitle(String title) {
        return (existing, candidates) -> candidates.stream()
                .filter(candidate -> candidate.getTitle().equals(title))
                .toList();
    }

    private static final class Recorder implements PlaylistListener {

        private final List<String> events = new ArrayList<>();

        @Override
        public void structureChanged(StructureChange change) {
            events.add(change.kind() + " " + change.start() + " " + change.count());
        }

        @Override
        public void dataChanged(int row) {
            events.add("data " + row);
        }

        @Override
        public void currentItemChanged(TrackMetadata previous, TrackMetadata current) {
            events.add("current " + title(previous) + " -> " + title(current));
        }

        @Override
        public void loadError(String message) {
            events.add("error " + message);
        }

        @Override
        public void playRequested(int row) {
            events.add("play " + row);
        }

        private static String title(TrackMetadata metadata) {
            return metadata == null ? "none" : metadata.title();
        }
    }

    // ========================================================================

    @Nested
    @DisplayName("Inserting")
    class Inserting {

        @Test
        @DisplayName("Inserted entries land at the position and notify observers")
        void insertAtPosition() {
            fill("A", "D");

            Range range = playlist.insertItems(tracks("B", "C"), 1, false, false);

            assertThat(range).isEqualTo(new Range(1, 2));
            assertThat(titles()).containsExactly("A", "B", "C", "D");
            assertThat(recorder.events).containsExactly("INSERTED 1 2");
        }

        @Test
        @DisplayName("Position beyond the end appends")
        void positionBeyondEndAppends() {
            fill("A");

            Range range = playlist.insertItems(tracks("B"), 42, false, false);

            assertThat(range.start()).isEqualTo(1);
            assertThat(titles()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("Play now makes the first inserted entry current and requests playback")
        void playNow() {
            fill("A");

            playlist.insertItems(tracks("B", "C"), -1, true, false);

            assertThat(playlist.currentRow()).isEqualTo(1);
            assertThat(recorder.events).containsExactly("INSERTED 1 2", "current none -> B", "play 1");
        }

        @Test
        @DisplayName("Enqueue queues the inserted rows")
        void enqueue() {
            fill("A", "B");

            playlist.insertItems(tracks("C", "D"), 0, false, true);

            assertThat(playlist.queue().rows()).containsExactly(0, 1);
            assertThat(playlist.nextRow()).isZero();
        }

        @Test
        @DisplayName("Vetoed entries are left out")
        void vetoRemovesEntries() {
            playlist.addVetoListener((existing, candidates) -> candidates.stream()
                    .filter(candidate -> candidate.getTitle().isEmpty())
                    .toList());

            Range range = playlist.insertItems(tracks("", "X"));

            assertThat(titles()).containsExactly("X");
            assertThat(range).isEqualTo(new Range(0, 1));
        }

        @Test
        @DisplayName("The picks of all veto listeners are combined")
        void vetoesAreCombined() {
            playlist.addVetoListener(vetoTitle("X"));
            playlist.addVetoListener(vetoTitle("Y"));

            playlist.insertItems(tracks("X", "Y", "Z"));

            assertThat(titles()).containsExactly("Z");
        }

        @Test
        @DisplayName("Vetoes exclude the very instances picked, not equal ones")
        void vetoByIdentity() {
            TrackEntry first = track("A");
            TrackEntry second = track("A");
            playlist.addVetoListener((existing, candidates) -> List.of(candidates.get(1)));

            playlist.insertItems(List.of(first, second));

            assertThat(playlist.size()).isEqualTo(1);
            assertThat(playlist.item(0)).isSameAs(first);
        }

        @Test
        @DisplayName("Veto listeners see the existing entries")
        void vetoSeesExistingEntries() {
            fill("A");
            playlist.addVetoListener((existing, candidates) -> candidates.stream()
                    .filter(candidate -> existing.stream().anyMatch(e -> e.getTitle().equals(candidate.getTitle())))
                    .toList());

            playlist.insertItems(tracks("A", "B"));

            assertThat(titles()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("Removed veto listeners are no longer asked")
        void removedVetoListener() {
            ListenerHandle handle = playlist.addVetoListener(vetoTitle("X"));

            assertThat(playlist.removeVetoListener(handle)).isTrue();
            playlist.insertItems(tracks("X"));

            assertThat(titles()).containsExactly("X");
            assertThat(playlist.removeVetoListener(handle)).isFalse();
        }

        @Test
        @DisplayName("An insertion vetoed entirely changes nothing and records no undo step")
        void fullyVetoed() {
            playlist.addVetoListener(vetoTitle("X"));

            Range range = playlist.insertItems(tracks("X"));

            assertThat(range.isEmpty()).isTrue();
            assertThat(playlist.mutationLog().canUndo()).isFalse();
            assertThat(recorder.events).isEmpty();
        }

        @Test
        @DisplayName("Generated entries bypass vetoes unless configured otherwise")
        void generatedEntriesAndVetoes() {
            playlist.addVetoListener(vetoTitle("X"));
            playlist.insertGeneratedItems(tracks("X"), -1, false, false);
            assertThat(titles()).containsExactly("X");

            Playlist strict = newPlaylist("strict", new EngineSettings(100, 5, 15, true));
            strict.addVetoListener(vetoTitle("X"));
            strict.insertGeneratedItems(tracks("X", "Y"), -1, false, false);
            assertThat(titles(strict)).containsExactly("Y");
        }
    }

    @Nested
    @DisplayName("Undo and redo")
    class UndoRedo {

        @Test
        @DisplayName("Undoing a removal puts the entry back")
        void undoRemove() {
            fill("A", "B", "C");

            List<TrackEntry> removed = playlist.removeItems(1, 1);
            assertThat(removed).extracting(TrackEntry::getTitle).containsExactly("B");
            assertThat(titles()).containsExactly("A", "C");

            assertThat(playlist.undo()).isTrue();
            assertThat(titles()).containsExactly("A", "B", "C");

            assertThat(playlist.redo()).isTrue();
            assertThat(titles()).containsExactly("A", "C");
        }

        @Test
        @DisplayName("Insert and remove are separate undo steps")
        void insertThenRemove() {
            playlist.insertItems(tracks("A", "B"));
            playlist.removeItems(0, 2);

            assertThat(playlist.mutationLog().undoDepth()).isEqualTo(2);
            playlist.undo();
            assertThat(titles()).containsExactly("A", "B");
            playlist.undo();
            assertThat(titles()).isEmpty();
            assertThat(playlist.undo()).isFalse();
        }

        @Test
        @DisplayName("Removing scattered rows is one step")
        void removeScatteredRows() {
            fill("A", "B", "C", "D", "E");

            playlist.removeRows(List.of(3, 0, 1));
            assertThat(titles()).containsExactly("C", "E");

            playlist.undo();
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E");
        }

        @Test
        @DisplayName("Undoing a move restores the order")
        void undoMove() {
            fill("A", "B", "C", "D", "E");

            int start = playlist.moveItems(List.of(0, 3), 2);
            assertThat(start).isEqualTo(2);
            assertThat(titles()).containsExactly("B", "C", "A", "D", "E");

            playlist.undo();
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E");
            playlist.redo();
            assertThat(titles()).containsExactly("B", "C", "A", "D", "E");
        }

        @Test
        @DisplayName("Moving a block to scattered destinations is undoable")
        void moveItemsTo() {
            fill("A", "B", "C", "D", "E");

            playlist.moveItemsTo(2, List.of(0, 3));
            assertThat(titles()).containsExactly("C", "A", "B", "D", "E");

            playlist.undo();
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E");
        }

        @Test
        @DisplayName("Destinations given out of order report the move from the lowest row")
        void moveItemsToUnsortedDestinations() {
            fill("A", "B", "C", "D", "E");

            playlist.moveItemsTo(3, List.of(4, 1));
            assertThat(titles()).containsExactly("A", "D", "B", "C", "E");
            assertThat(recorder.events).contains("MOVED 1 2").doesNotContain("MOVED 3 2");

            recorder.events.clear();
            playlist.undo();
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E");
            assertThat(recorder.events).contains("MOVED 1 2").doesNotContain("MOVED 3 2");
        }

        @Test
        @DisplayName("Sorting is undoable")
        void undoSort() {
            fill("C", "a", "B");

            playlist.sort(SortField.TITLE, true);
            assertThat(titles()).containsExactly("a", "B", "C");

            playlist.sort(SortField.TITLE, false);
            assertThat(titles()).containsExactly("C", "B", "a");

            playlist.undo();
            playlist.undo();
            assertThat(titles()).containsExactly("C", "a", "B");
        }

        @Test
        @DisplayName("Shuffling is undoable")
        void undoShuffle() {
            fill("A", "B", "C", "D", "E", "F", "G", "H");

            playlist.shuffle();
            assertThat(titles()).containsExactlyInAnyOrder("A", "B", "C", "D", "E", "F", "G", "H");

            playlist.undo();
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E", "F", "G", "H");
        }

        @Test
        @DisplayName("Changes without undo clear the history")
        void bypassClearsHistory() {
            fill("A", "B", "C");
            playlist.removeItems(0, 1);
            playlist.undo();

            playlist.removeItemsWithoutUndo(0, 1);

            assertThat(playlist.mutationLog().canUndo()).isFalse();
            assertThat(playlist.mutationLog().canRedo()).isFalse();
            assertThat(titles()).containsExactly("B", "C");
        }

        @Test
        @DisplayName("A failed removal leaves playlist and history untouched")
        void outOfRangeRemoval() {
            fill("A");

            assertThatThrownBy(() -> playlist.removeItems(5, 1))
                    .isInstanceOf(OutOfRangeException.class);
            assertThat(titles()).containsExactly("A");
            assertThat(playlist.mutationLog().undoDepth()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Pointers")
    class Pointers {

        @Test
        @DisplayName("The current item follows its entry through moves and sorts")
        void currentFollowsEntry() {
            fill("C", "A", "B");
            playlist.setCurrentRow(1);

            playlist.moveItems(List.of(1), 3);
            assertThat(playlist.currentRow()).isEqualTo(2);

            playlist.sort(SortField.TITLE, true);
            assertThat(playlist.currentRow()).isZero();
            assertThat(playlist.lastPlayedRow()).isZero();

            playlist.undo();
            assertThat(playlist.currentRow()).isEqualTo(2);
        }

        @Test
        @DisplayName("Removing the current item clears it and notifies after the structure change")
        void removingCurrent() {
            fill("A", "B", "C");
            playlist.setCurrentRow(1);
            playlist.setStopAfter(1);
            recorder.events.clear();

            playlist.removeItems(1, 1);

            assertThat(playlist.currentRow()).isEqualTo(-1);
            assertThat(playlist.lastPlayedRow()).isEqualTo(-1);
            assertThat(playlist.stopAfterRow()).isEqualTo(-1);
            assertThat(recorder.events).containsExactly("REMOVED 1 1", "current B -> none");

            playlist.undo();
            assertThat(playlist.currentRow()).isEqualTo(-1);
        }

        @Test
        @DisplayName("Setting the current row reports the change")
        void setCurrentRow() {
            fill("A", "B");

            playlist.setCurrentRow(0);
            playlist.setCurrentRow(1);
            playlist.setCurrentRow(-1);

            assertThat(recorder.events)
                    .containsExactly("current none -> A", "current A -> B", "current B -> none");
            assertThat(playlist.lastPlayedRow()).isEqualTo(1);
        }

        @Test
        @DisplayName("Setting an invalid current row fails")
        void invalidCurrentRow() {
            fill("A");

            assertThatThrownBy(() -> playlist.setCurrentRow(1))
                    .isInstanceOf(OutOfRangeException.class);
        }

        @Test
        @DisplayName("Stop-after toggles and halts playback after its entry")
        void stopAfter() {
            fill("A", "B", "C");
            playlist.setCurrentRow(0);

            playlist.setStopAfter(0);
            assertThat(playlist.stopAfterCurrent()).isTrue();

            assertThat(playlist.playNext()).isEqualTo(-1);
            assertThat(playlist.currentRow()).isEqualTo(-1);
            assertThat(playlist.stopAfterRow()).isEqualTo(-1);

            playlist.setStopAfter(2);
            playlist.setStopAfter(2);
            assertThat(playlist.stopAfterRow()).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("playNext walks the order and stops at the end")
        void playNext() {
            fill("A", "B");

            assertThat(playlist.playNext()).isZero();
            assertThat(playlist.playNext()).isEqualTo(1);
            assertThat(playlist.playNext()).isEqualTo(-1);
        }

        @Test
        @DisplayName("Repeat playlist wraps around")
        void repeatPlaylist() {
            fill("A", "B");
            playlist.setRepeatMode(RepeatMode.PLAYLIST);
            playlist.setCurrentRow(1);

            assertThat(playlist.playNext()).isZero();
            assertThat(playlist.playPrevious()).isEqualTo(1);
        }

        @Test
        @DisplayName("Queued rows play first")
        void queueFirst() {
            fill("A", "B", "C", "D");
            playlist.setCurrentRow(0);
            playlist.enqueue(List.of(3));

            assertThat(playlist.nextRow()).isEqualTo(3);
            assertThat(playlist.playNext()).isEqualTo(3);
            assertThat(playlist.queue().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Enqueuing an invalid row fails")
        void enqueueInvalidRow() {
            fill("A");

            assertThatThrownBy(() -> playlist.enqueue(List.of(4)))
                    .isInstanceOf(OutOfRangeException.class);
        }

        @Test
        @DisplayName("The filter text hides entries from traversal")
        void filterText() {
            fill("Alpha", "Beta", "Gamma");

            playlist.setFilterText("mm");
            assertThat(playlist.nextRow()).isEqualTo(2);
            assertThat(playlist.isVisible(0)).isFalse();

            playlist.setFilterText(" ");
            assertThat(playlist.nextRow()).isZero();
        }

        @Test
        @DisplayName("Shuffle mode changes the order but not the display order")
        void shuffleMode() {
            fill("A", "B", "C", "D", "E");
            playlist.setCurrentRow(3);

            playlist.setShuffleMode(ShuffleMode.ALL);

            assertThat(playlist.playbackOrder().order().get(0)).isEqualTo(3);
            assertThat(titles()).containsExactly("A", "B", "C", "D", "E");
        }
    }

    @Nested
    @DisplayName("Queue")
    class Queue {

        @Test
        @DisplayName("Queued rows are renumbered when entries move or disappear")
        void queueIsRemapped() {
            fill("A", "B", "C", "D");
            playlist.enqueue(List.of(2, 3));

            playlist.removeItems(0, 1);
            assertThat(playlist.queue().rows()).containsExactly(1, 2);

            playlist.removeItems(1, 1);
            assertThat(playlist.queue().rows()).containsExactly(1);

            playlist.moveItems(List.of(1), 0);
            assertThat(playlist.queue().rows()).containsExactly(0);
            assertThat(playlist.item(0).getTitle()).isEqualTo("D");
        }

        @Test
        @DisplayName("Removing unqueued entries keeps only the queue")
        void removeItemsNotInQueue() {
            fill("A", "B", "C", "D");
            playlist.enqueue(List.of(3, 1));

            playlist.removeItemsNotInQueue();

            assertThat(titles()).containsExactly("B", "D");
            assertThat(playlist.queue().rows()).containsExactly(1, 0);
            assertThat(playlist.mutationLog().canUndo()).isFalse();
        }
    }

    @Nested
    @DisplayName("In-place updates")
    class InPlace {

        @Test
        @DisplayName("Stream metadata overrides the current stream until another track plays")
        void streamMetadata() {
            playlist.insertItems(List.of(stream("radio", "http://radio.example/live"), track("B")));
            playlist.setCurrentRow(0);
            recorder.events.clear();

            playlist.setStreamMetadata("http://radio.example/other", TrackMetadata.titled("Ignored"));
            playlist.setStreamMetadata("http://radio.example/live", TrackMetadata.titled("Now playing"));

            assertThat(playlist.item(0).getTitle()).isEqualTo("Now playing");
            assertThat(playlist.item(0).getStaticMetadata().title()).isEqualTo("radio");
            assertThat(recorder.events).containsExactly("data 0", "current radio -> Now playing");

            playlist.setCurrentRow(1);
            assertThat(playlist.item(0).hasTemporaryMetadata()).isFalse();
            assertThat(playlist.snapshot().entries().get(0).getTitle()).isEqualTo("radio");
        }

        @Test
        @DisplayName("Rating is stored on the entry and must lie between 0 and 1")
        void rating() {
            fill("A");

            playlist.rateItem(0, 0.8f);

            assertThat(playlist.item(0).getMetadata().rating()).isEqualTo(0.8f);
            assertThat(recorder.events).containsExactly("data 0");
            assertThatThrownBy(() -> playlist.rateItem(0, 1.5f))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Library changes refresh every entry of that record")
        void libraryItemsChanged() {
            playlist.insertItems(List.of(
                    TrackEntry.library(7, TrackMetadata.titled("Old")),
                    track("X"),
                    TrackEntry.library(7, TrackMetadata.titled("Old"))));
            recorder.events.clear();

            playlist.libraryItemsChanged(List.of(TrackEntry.library(7, TrackMetadata.titled("New"))));

            assertThat(titles()).containsExactly("New", "X", "New");
            assertThat(recorder.events).containsExactly("data 0", "data 2");
            assertThat(playlist.libraryItemsById(7)).hasSize(2);
        }

        @Test
        @DisplayName("Unavailable entries are greyed out and restored when they come back")
        void invalidateDeletedItems() {
            fill("A", "B", "C");

            int changed = playlist.invalidateDeletedItems(entry -> !entry.getTitle().equals("B"));
            assertThat(changed).isEqualTo(1);
            assertThat(playlist.item(1).isValid()).isFalse();

            assertThat(playlist.invalidateDeletedItems(entry -> true)).isEqualTo(1);
            assertThat(playlist.item(1).isValid()).isTrue();
        }

        @Test
        @DisplayName("Validity is only applied to the matching current item")
        void validityOnCurrentItem() {
            fill("A", "B");

            assertThat(playlist.applyValidityOnCurrentItem("file:///music/A.mp3", false)).isFalse();

            playlist.setCurrentRow(0);
            assertThat(playlist.applyValidityOnCurrentItem("file:///music/B.mp3", false)).isTrue();
            assertThat(playlist.item(0).isValid()).isTrue();

            playlist.applyValidityOnCurrentItem("file:///music/A.mp3", false);
            assertThat(playlist.item(0).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Clear and restore")
    class ClearAndRestore {

        @Test
        @DisplayName("Clear empties everything and starts a new epoch")
        void clear() {
            fill("A", "B", "C");
            playlist.setCurrentRow(0);
            playlist.enqueue(List.of(2));
            recorder.events.clear();
            long epoch = playlist.epoch();

            playlist.clear();

            assertThat(playlist.size()).isZero();
            assertThat(playlist.epoch()).isEqualTo(epoch + 1);
            assertThat(playlist.currentRow()).isEqualTo(-1);
            assertThat(playlist.queue().isEmpty()).isTrue();
            assertThat(playlist.mutationLog().canUndo()).isFalse();
            assertThat(recorder.events).containsExactly("CLEARED 0 3", "current A -> none");
        }

        @Test
        @DisplayName("A snapshot restores entries, pointers and modes")
        void snapshotRestore() {
            fill("A", "B", "C");
            playlist.setCurrentRow(1);
            playlist.setStopAfter(2);
            playlist.setRepeatMode(RepeatMode.PLAYLIST);
            playlist.setShuffleMode(ShuffleMode.BY_ALBUM);

            PlaylistSnapshot snapshot = playlist.snapshot();
            Playlist restored = newPlaylist("main", EngineSettings.defaults());
            restored.restore(snapshot, null);

            assertThat(restored.items()).isEqualTo(playlist.items());
            assertThat(restored.currentRow()).isEqualTo(1);
            assertThat(restored.lastPlayedRow()).isEqualTo(1);
            assertThat(restored.stopAfterRow()).isEqualTo(2);
            assertThat(restored.repeatMode()).isEqualTo(RepeatMode.PLAYLIST);
            assertThat(restored.shuffleMode()).isEqualTo(ShuffleMode.BY_ALBUM);
            assertThat(restored.mutationLog().canUndo()).isFalse();
            assertThat(restored.isDynamic()).isFalse();
        }

        @Test
        @DisplayName("Out of range pointers in a snapshot are dropped")
        void snapshotWithStalePointers() {
            PlaylistSnapshot snapshot = new PlaylistSnapshot("main", tracks("A"), 4, -1, 9,
                    RepeatMode.OFF, ShuffleMode.OFF, null);

            playlist.restore(snapshot, null);

            assertThat(titles()).containsExactly("A");
            assertThat(playlist.currentRow()).isEqualTo(-1);
            assertThat(playlist.stopAfterRow()).isEqualTo(-1);
        }
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void failingListener() {
        playlist.addListener(new PlaylistListener() {
            @Override
            public void structureChanged(StructureChange change) {
                throw new IllegalStateException("boom");
            }
        });
        Recorder late = new Recorder();
        playlist.addListener(late);

        playlist.insertItems(tracks("A"));

        assertThat(titles()).containsExactly("A");
        assertThat(late.events).containsExactly("INSERTED 0 1");
    }

    @Test
    @DisplayName("Removed listeners are no longer notified")
    void removeListener() {
        Recorder other = new Recorder();
        ListenerHandle handle = playlist.addListener(other);

        assertThat(playlist.removeListener(handle)).isTrue();
        playlist.insertItems(tracks("A"));

        assertThat(other.events).isEmpty();
        assertThat(recorder.events).containsExactly("INSERTED 0 1");
    }

    @Test
    @DisplayName("Load errors are forwarded to listeners")
    void loadError() {
        playlist.reportLoadError("cannot read x.mp3");

        assertThat(recorder.events).containsExactly("error cannot read x.mp3");
    }

    @Nested
    @DisplayName("Random operation sequences")
    class RandomSequences {

        private static final int STEPS = 300;

        @Test
        @DisplayName("Playback order stays a permutation and the library index stays exact under every shuffle mode")
        void invariantsHold() {
            for (ShuffleMode mode : ShuffleMode.values()) {
                Random random = new Random(mode.ordinal() * 31L + 5);
                Playlist subject = newPlaylist("random-" + mode, new EngineSettings(20, 5, 15, false));
                subject.setShuffleMode(mode);

                for (int step = 0; step < STEPS; step++) {
                    applyRandomOperation(subject, random);
                    assertInvariants(subject, mode + " step " + step);
                }
            }
        }

        private void applyRandomOperation(Playlist subject, Random random) {
            int size = subject.size();
            switch (random.nextInt(7)) {
                case 0, 1 -> subject.insertItems(randomEntries(random), random.nextInt(size + 2) - 1, false, false);
                case 2 -> {
                    if (size > 0) {
                        int position = random.nextInt(size);
                        subject.removeItems(position, 1 + random.nextInt(size - position));
                    }
                }
                case 3 -> {
                    if (size > 0) {
                        List<Integer> sources = new ArrayList<>();
                        for (int i = 0; i < 1 + random.nextInt(3); i++) {
                            sources.add(random.nextInt(size));
                        }
                        subject.moveItems(sources, random.nextInt(size + 1));
                    }
                }
                case 4 -> subject.undo();
                case 5 -> subject.redo();
                default -> {
                    if (size > 0) {
                        subject.setCurrentRow(random.nextInt(size));
                    }
                }
            }
        }

        private List<TrackEntry> randomEntries(Random random) {
            List<TrackEntry> entries = new ArrayList<>();
            for (int i = 0; i < 1 + random.nextInt(4); i++) {
                int n = random.nextInt(6);
                TrackMetadata metadata = TrackMetadata.of("T" + n, "Artist " + n % 3, "Album " + n % 2, 100,
                        "file:///music/" + n + ".mp3");
                entries.add(random.nextBoolean() ? TrackEntry.library(n, metadata) : TrackEntry.url(metadata));
            }
            return entries;
        }

        private void assertInvariants(Playlist subject, String description) {
            List<Integer> expectedRows = new ArrayList<>();
            for (int row = 0; row < subject.size(); row++) {
                expectedRows.add(row);
            }
            assertThat(subject.playbackOrder().order())
                    .as("order after %s", description)
                    .containsExactlyInAnyOrderElementsOf(expectedRows);

            Map<Long, List<Integer>> expectedIndex = new TreeMap<>();
            List<TrackEntry> entries = subject.store().entries();
            for (int row = 0; row < entries.size(); row++) {
                Long libraryId = entries.get(row).getLibraryId();
                if (libraryId != null) {
                    expectedIndex.computeIfAbsent(libraryId, id -> new ArrayList<>()).add(row);
                }
            }
            assertThat(subject.store().libraryIndex())
                    .as("library index after %s", description)
                    .isEqualTo(expectedIndex);
        }
    }
}
