package com.phillippitts.servicelog;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
        "servicelog.service-name=context-test",
        "servicelog.target=STDERR"
    }
)
class ServiceLogApplicationTests {

    @Test
    void contextLoads() {
    }

}
