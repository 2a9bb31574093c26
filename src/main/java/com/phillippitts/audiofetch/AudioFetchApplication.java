package com.phillippitts.audiofetch;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.config.properties.RetryProperties;
import com.phillippitts.audiofetch.config.properties.SearchProperties;
import com.phillippitts.audiofetch.config.properties.ThreadPoolProperties;
import com.phillippitts.audiofetch.config.properties.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SearchProperties.class,
        AcquisitionProperties.class,
        ToolProperties.class,
        RetryProperties.class,
        ThreadPoolProperties.class
})
public class AudioFetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioFetchApplication.class, args);
    }

}
