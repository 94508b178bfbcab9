package com.phillippitts.convocapture;

import com.phillippitts.convocapture.config.properties.AudioCaptureProperties;
import com.phillippitts.convocapture.config.properties.SessionProperties;
import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        TranscriptionProperties.class,
        SessionProperties.class
})
public class ConvoCaptureApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConvoCaptureApplication.class, args);
    }

}
