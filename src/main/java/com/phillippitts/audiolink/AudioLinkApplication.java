package com.phillippitts.audiolink;

import com.phillippitts.audiolink.config.properties.CorsProperties;
import com.phillippitts.audiolink.config.properties.EncodeProperties;
import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.config.properties.ThreadPoolProperties;
import com.phillippitts.audiolink.config.properties.UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ModemProperties.class,
        UploadProperties.class,
        EncodeProperties.class,
        ThreadPoolProperties.class,
        CorsProperties.class
})
public class AudioLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioLinkApplication.class, args);
    }

}
