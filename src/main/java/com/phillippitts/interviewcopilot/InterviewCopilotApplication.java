package com.phillippitts.interviewcopilot;

import com.phillippitts.interviewcopilot.config.properties.AudioCaptureProperties;
import com.phillippitts.interviewcopilot.config.properties.ClientProperties;
import com.phillippitts.interviewcopilot.config.properties.GenerationProperties;
import com.phillippitts.interviewcopilot.config.properties.RecognizerProperties;
import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import com.phillippitts.interviewcopilot.config.properties.TransportProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        TransportProperties.class,
        SessionProperties.class,
        GenerationProperties.class,
        RecognizerProperties.class,
        ClientProperties.class
})
@EnableScheduling
public class InterviewCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewCopilotApplication.class, args);
    }

}
