package com.lmbridge.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmbridge.album.CacheStatusTracker;
import com.lmbridge.album.ReleaseGroupService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.sql.SQLException;

@RestController
public class AlbumController {

    public static final String CACHE_HEADER = "X-LMBridge-Cache";

    private final ReleaseGroupService releaseGroupService;
    private final CacheStatusTracker cacheStatus;

    public AlbumController(ReleaseGroupService releaseGroupService, CacheStatusTracker cacheStatus) {
        this.releaseGroupService = releaseGroupService;
        this.cacheStatus = cacheStatus;
    }

    /**
     * Release-group document by MBID.
     *
     * GET /album/{mbid}
     *
     * @param mbid release-group MBID
     * @return document, with the album cache outcome in {@value #CACHE_HEADER}
     * @throws SQLException on database errors
     */
    @GetMapping("/album/{mbid}")
    public ResponseEntity<JsonNode> getAlbum(@PathVariable("mbid") String mbid) throws SQLException {
        JsonNode doc = releaseGroupService.getReleaseGroup(mbid);
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        String status = cacheStatus.getStatus();
        if (status != null) {
            builder.header(CACHE_HEADER, status);
        }
        return builder.body(doc);
    }
}
