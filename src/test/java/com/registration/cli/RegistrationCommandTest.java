package com.registration.cli;

import com.registration.SyntheticRasters;
import com.registration.exception.InsufficientMatchesException;
import com.registration.exception.UnreadableRasterException;
import com.registration.homography.HomographyMatrix;
import com.registration.homography.InlierSet;
import com.registration.imageRegistration.ImageRegistration;
import com.registration.imageRegistration.ManualAdjustment;
import com.registration.imageRegistration.RegistrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrationCommandTest {

    @Mock
    private ImageRegistration registration;

    @Mock
    private ManualAdjustment adjustment;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private RegistrationCommand command;

    @BeforeEach
    void setUp() {
        command = new RegistrationCommand(registration, adjustment,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void whenRegisterSucceedsThenExitZero() throws Exception {
        RegistrationResult result = new RegistrationResult(HomographyMatrix.translation(5, 3),
                new InlierSet(new boolean[]{true, true, true, true, false}), 5, 120, 130,
                SyntheticRasters.constant(4, 4, 0f));
        when(registration.registerFiles(eq(Paths.get("ortho.tif")), eq(Paths.get("chm.tif")),
                eq(Paths.get("out.tif")), any())).thenReturn(result);

        int code = command.execute("register", "ortho.tif", "chm.tif", "out.tif");

        assertThat(code).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("5 matches", "4 inliers");
        assertThat(stderr()).isEmpty();
    }

    @Test
    void whenRegistrationFailsThenExitOneWithDiagnostic() throws Exception {
        when(registration.registerFiles(any(), any(), any(), any()))
                .thenThrow(new InsufficientMatchesException(9, 10, 0.75));

        int code = command.execute("register", "ortho.tif", "chm.tif", "out.tif");

        assertThat(code).isEqualTo(1);
        assertThat(stderr()).startsWith("Error: ").contains("found 9", "at least 10");
    }

    @Test
    void whenSourceUnreadableThenExitOne() throws Exception {
        when(registration.registerFiles(any(), any(), any(), any()))
                .thenThrow(new UnreadableRasterException(Paths.get("ortho.tif"), "file does not exist"));

        assertThat(command.execute("register", "ortho.tif", "chm.tif", "out.tif")).isEqualTo(1);
        assertThat(stderr()).contains("ortho.tif", "file does not exist");
    }

    @Test
    void whenWrongArityThenUsage() {
        assertThat(command.execute("register", "ortho.tif", "chm.tif")).isEqualTo(1);
        assertThat(stderr()).contains("Usage:");
        verifyNoInteractions(registration, adjustment);
    }

    @Test
    void whenUnknownOrMissingCommandThenUsage() {
        assertThat(command.execute("stitch", "a", "b")).isEqualTo(1);
        assertThat(command.execute()).isEqualTo(1);
        assertThat(stderr()).contains("unknown command 'stitch'", "Usage:");
    }

    @Test
    void whenAdjustThenOffsetsArePassedThrough() throws Exception {
        int code = command.execute("adjust", "registered.tif", "final.tif", "1.5", "-2");

        assertThat(code).isZero();
        verify(adjustment).apply(Paths.get("registered.tif"), Paths.get("final.tif"), 1.5, -2.0);
    }

    @Test
    void whenAdjustOffsetsAreNotNumbersThenUsage() {
        assertThat(command.execute("adjust", "registered.tif", "final.tif", "left", "2")).isEqualTo(1);
        assertThat(stderr()).contains("dx and dy must be numbers");
        verifyNoInteractions(adjustment);
    }

    @Test
    void recognisesCommands() {
        assertThat(RegistrationCommand.isCommand(new String[]{"register", "a", "b", "c"})).isTrue();
        assertThat(RegistrationCommand.isCommand(new String[]{"adjust"})).isTrue();
        assertThat(RegistrationCommand.isCommand(new String[]{"--server.port=9090"})).isFalse();
        assertThat(RegistrationCommand.isCommand(new String[0])).isFalse();
    }
}
