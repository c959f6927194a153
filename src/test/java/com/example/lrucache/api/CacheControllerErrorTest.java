package com.example.lrucache.api;

import com.example.lrucache.core.LruCache;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;

@WebMvcTest(CacheController.class)
class CacheControllerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LruCache<String, String> cache;

    @Test
    void internalFailureIsNotReportedAsBadRequest() {
        when(cache.get("alpha")).thenThrow(new NullPointerException("internal"));

        ServletException e = assertThrows(ServletException.class,
            () -> mockMvc.perform(get("/cache/alpha")));
        assertInstanceOf(NullPointerException.class, e.getCause());
    }
}
