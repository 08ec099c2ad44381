package com.williamcallahan.newsingest;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.ingestion.run-on-startup=false",
        "app.ingestion.write-statistics=false"
})
class NewsIngestApplicationTests {

    @Test
    void contextLoads() {
    }

}
