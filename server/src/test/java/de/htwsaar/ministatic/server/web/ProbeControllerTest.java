package de.htwsaar.ministatic.server.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ProbeControllerTest {

    private final MockMvc mvc = MockMvcBuilders.standaloneSetup(new ProbeController()).build();

    @Test
    void healthAndReadyAnswer() throws Exception {
        mvc.perform(get("/api/static/health")).andExpect(status().isOk()).andExpect(content().string("ok"));
        mvc.perform(get("/api/static/ready")).andExpect(status().isOk()).andExpect(content().string("ready"));
    }
}
