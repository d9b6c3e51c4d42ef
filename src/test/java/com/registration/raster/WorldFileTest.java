package com.registration.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WorldFileTest {

    @TempDir
    Path dir;

    @Test
    void sidecarNamesFollowTheFirstAndLastLetterRule() {
        assertThat(WorldFile.sidecarFor(Paths.get("a/ortho.tif")).getFileName().toString()).isEqualTo("ortho.tfw");
        assertThat(WorldFile.sidecarFor(Paths.get("chm.tiff")).getFileName().toString()).isEqualTo("chm.tfw");
        assertThat(WorldFile.sidecarFor(Paths.get("x.png")).getFileName().toString()).isEqualTo("x.pgw");
        assertThat(WorldFile.sidecarFor(Paths.get("x.JPEG")).getFileName().toString()).isEqualTo("x.jgw");
        assertThat(WorldFile.sidecarFor(Paths.get("noext")).getFileName().toString()).isEqualTo("noext.wld");
        assertThat(WorldFile.projectionFor(Paths.get("ortho.tif")).getFileName().toString()).isEqualTo("ortho.prj");
        assertThat(WorldFile.genericSidecarFor(Paths.get("ortho.tif")).getFileName().toString()).isEqualTo("ortho.wld");
    }

    @Test
    void writtenValuesAreCentreOfUpperLeftPixel() throws Exception {
        Path file = dir.resolve("r.tfw");
        WorldFile.write(file, new GeoTransform(100.0, 2.0, 0.0, 500.0, 0.0, -2.0));

        double[] lines = Files.readAllLines(file).stream().mapToDouble(Double::parseDouble).toArray();
        assertThat(lines).containsExactly(2.0, 0.0, 0.0, -2.0, 101.0, 499.0);
    }

    @Test
    void roundTrip() throws Exception {
        GeoTransform geo = new GeoTransform(612345.25, 0.1, 0.002, 5423456.75, -0.003, -0.1);
        Path file = dir.resolve("r.tfw");

        WorldFile.write(file, geo);
        double[] back = WorldFile.read(file).coefficients();

        double[] expected = geo.coefficients();
        for (int i = 0; i < 6; i++) {
            assertThat(back[i]).as("coefficient %d of %s", i, Arrays.toString(back)).isCloseTo(expected[i], within(1e-8));
        }
    }
}
