package com.phillippitts.convocapture.service.audio.capture;

import com.phillippitts.convocapture.config.properties.AudioCaptureProperties;
import com.phillippitts.convocapture.exception.DeviceUnavailableException;
import com.phillippitts.convocapture.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based microphone factory producing raw PCM16LE mono @16kHz inputs.
 *
 * <p>This is the default implementation of {@link MicrophoneFactory}. Every call to
 * {@link #open()} opens a fresh {@link TargetDataLine}, so concurrent sessions each own
 * their line. Test configurations can provide alternative implementations by marking them
 * as @Primary.
 */
@Component
public class JavaSoundMicrophoneFactory implements MicrophoneFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophoneFactory.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundMicrophoneFactory(AudioCaptureProperties props,
                                      ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundMicrophoneFactory(AudioCaptureProperties props,
                               ApplicationEventPublisher publisher,
                               DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String os = System.getProperty("os.name");
        String arch = System.getProperty("os.arch");
        int mixerCount = AudioSystem.getMixerInfo().length;

        LOG.info("Microphone capture initialized: OS={}, arch={}, device='{}', available-mixers={}, chunk={}ms",
                os, arch, deviceLabel(), mixerCount, props.getChunkMillis());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public Microphone open() {
        logInputDevices();
        javax.sound.sampled.AudioFormat fmt = AudioFormat.toJavaSound();
        try {
            TargetDataLine line = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
            LOG.info("Opened input line on device '{}'", deviceLabel());
            return new JavaSoundMicrophone(line, AudioFormat.bytesPerChunk(props.getChunkMillis()));
        } catch (LineUnavailableException | IllegalArgumentException e) {
            // IllegalArgumentException: no line matching the required format on this system
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            throw fail(DeviceUnavailableException.MIC_UNAVAILABLE, e);
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            throw fail(DeviceUnavailableException.MIC_PERMISSION_DENIED, se);
        }
    }

    private DeviceUnavailableException fail(String reason, Exception cause) {
        publisher.publishEvent(new CaptureErrorEvent(reason, deviceLabel(), Instant.now()));
        return new DeviceUnavailableException(reason, String.valueOf(cause.getMessage()), cause);
    }

    private void logInputDevices() {
        try {
            for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                Mixer mixer = AudioSystem.getMixer(info);
                if (mixer.getTargetLineInfo().length > 0) {
                    LOG.info("[Audio Device] name='{}' vendor='{}' inputs={}",
                            info.getName(), info.getVendor(), mixer.getTargetLineInfo().length);
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Unable to enumerate audio devices: {}", e.toString());
        }
    }

    private String deviceLabel() {
        return props.getDeviceName() != null ? props.getDeviceName() : "default";
    }
}
