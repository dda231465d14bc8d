package com.sommerph.makoto.config;

import com.sommerph.makoto.util.DsseUtils;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "makoto")
public class MakotoProperties {

    private Keys keys = new Keys();
    private Envelope envelope = new Envelope();

    @Data
    public static class Keys {
        // generate | pem | raw
        private String source = "generate";
        private String pemPath;
        private String privateKeyHex;
    }

    @Data
    public static class Envelope {
        private String payloadType = DsseUtils.IN_TOTO_PAYLOAD_TYPE;
    }

}
