package com.example.mediastore_backend.layout;

import com.example.mediastore_backend.util.PathType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StorageLayoutTest {

    private static final UUID OWNER = UUID.fromString("11111111-2222-3333-4444-555555555555");
    private static final UUID ASSET = UUID.fromString("abcdef01-2345-6789-abcd-ef0123456789");

    private static final MediaLocation LOCAL = MediaLocation.of("/srv/media");
    private static final MediaLocation REMOTE = MediaLocation.of("t3.storage.dev/photos");

    private final PathOwner asset = new PathOwner() {
        @Override
        public UUID getId() {
            return ASSET;
        }

        @Override
        public UUID getOwnerId() {
            return OWNER;
        }
    };

    @Test
    void imagePathIsFannedOutByFileName() {
        String path = StorageLayout.getImagePath(LOCAL, asset, PathType.THUMBNAIL, ImageFormat.WEBP);

        assertThat(path).isEqualTo("/srv/media/thumbs/" + OWNER + "/ab/cd/" + ASSET + "-thumbnail.webp");
    }

    @Test
    void remoteLocationYieldsRemotePaths() {
        String path = StorageLayout.getImagePath(REMOTE, asset, PathType.PREVIEW, ImageFormat.JPEG);

        assertThat(path).isEqualTo("t3.storage.dev/photos/thumbs/" + OWNER + "/ab/cd/" + ASSET + "-preview.jpeg");
    }

    @Test
    void onlyGeneratedImagesHaveImagePaths() {
        assertThrows(IllegalArgumentException.class,
                () -> StorageLayout.getImagePath(LOCAL, asset, PathType.ORIGINAL, ImageFormat.JPEG));
    }

    @Test
    void encodedVideoAndMotionPaths() {
        UUID motion = UUID.fromString("99999999-0000-0000-0000-000000000000");

        assertThat(StorageLayout.getEncodedVideoPath(LOCAL, asset))
                .isEqualTo("/srv/media/encoded-video/" + OWNER + "/ab/cd/" + ASSET + ".mp4");
        String motionPath = StorageLayout.getAndroidMotionPath(LOCAL, asset, motion);
        assertThat(motionPath).isEqualTo("/srv/media/encoded-video/" + OWNER + "/99/99/" + motion + "-MP.mp4");
        assertThat(StorageLayout.isAndroidMotionPath(LOCAL, motionPath)).isTrue();
        assertThat(StorageLayout.isAndroidMotionPath(LOCAL, "/srv/media/library/x.mp4")).isFalse();
    }

    @Test
    void personThumbnailIsJpegInThumbs() {
        assertThat(StorageLayout.getPersonThumbnailPath(LOCAL, asset))
                .isEqualTo("/srv/media/thumbs/" + OWNER + "/ab/cd/" + ASSET + ".jpeg");
    }

    @Test
    void libraryFolderPrefersStorageLabel() {
        assertThat(StorageLayout.getLibraryFolder(LOCAL, "alice", OWNER)).isEqualTo("/srv/media/library/alice");
        assertThat(StorageLayout.getLibraryFolder(LOCAL, " ", OWNER)).isEqualTo("/srv/media/library/" + OWNER);
    }

    @Test
    void shortFileNamesStillNest() {
        assertThat(StorageLayout.getNestedPath(LOCAL, StorageFolder.UPLOAD, OWNER, "abc"))
                .isEqualTo("/srv/media/upload/" + OWNER + "/ab/c/abc");
    }

    @Test
    void mediaPathDetection() {
        assertThat(StorageLayout.isMediaPath(LOCAL, "/srv/media/library/a.jpg")).isTrue();
        assertThat(StorageLayout.isMediaPath(LOCAL, "/srv/media/../etc/passwd")).isFalse();
        assertThat(StorageLayout.isMediaPath(LOCAL, "/srv/mediax/a.jpg")).isFalse();
        assertThat(StorageLayout.isMediaPath(LOCAL, "relative/a.jpg")).isFalse();
        assertThat(StorageLayout.isMediaPath(LOCAL, "t3.storage.dev/photos/a.jpg")).isTrue();
    }

    @Test
    void tempPathIsInsideDirectory() {
        assertThat(StorageLayout.getTempPathInDir("/tmp/work")).startsWith("/tmp/work/").endsWith(".tmp");
    }

    @Test
    void folderLookupAcceptsNameOrConstant() {
        assertThat(StorageFolder.fromValue("encoded-video")).isEqualTo(StorageFolder.ENCODED_VIDEO);
        assertThat(StorageFolder.fromValue("THUMBNAILS")).isEqualTo(StorageFolder.THUMBNAILS);
        assertThrows(IllegalArgumentException.class, () -> StorageFolder.fromValue("cache"));
    }
}
