package com.ciro.jcss.spring;

import com.ciro.jcss.api.ApiResponse;
import com.ciro.jcss.api.CssHttpApi;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/css")
public class CssController {

    private final CssHttpApi api;

    public CssController(CssHttpApi api) {
        this.api = api;
    }

    @PostMapping(value = "/{operation}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> call(@PathVariable String operation,
                                       @RequestBody(required = false) Map<String, Object> body) {
        return toEntity(api.call(operation, body == null ? Map.of() : body));
    }

    /** El cuerpo es el CSS; los demás argumentos van en la query. */
    @PostMapping(value = "/{operation}", consumes = "text/css")
    public ResponseEntity<String> callWithCss(@PathVariable String operation,
                                              @RequestBody(required = false) byte[] css,
                                              @RequestParam Map<String, String> params) {
        return toEntity(api.callWithCss(operation, css == null ? new byte[0] : css, params));
    }

    static ResponseEntity<String> toEntity(ApiResponse response) {
        return ResponseEntity.status(response.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(response.json());
    }
}
