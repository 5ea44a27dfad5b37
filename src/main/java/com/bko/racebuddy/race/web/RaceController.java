package com.bko.racebuddy.race.web;

import com.bko.racebuddy.race.Race;
import com.bko.racebuddy.race.RaceCatalog;
import com.bko.racebuddy.race.RaceStatistics;
import com.bko.racebuddy.race.RaceTips;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/races")
public class RaceController {
    private final RaceCatalog raceCatalog;

    public RaceController(RaceCatalog raceCatalog) {
        this.raceCatalog = raceCatalog;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Race> races() {
        return raceCatalog.list();
    }

    @GetMapping(value = "/{raceId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Race> race(@PathVariable String raceId) {
        return raceCatalog.find(raceId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{raceId}/tips", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RaceTips> tips(@PathVariable String raceId) {
        return raceCatalog.find(raceId)
                .map(Race::tips)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{raceId}/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RaceStatistics> statistics(@PathVariable String raceId) {
        return raceCatalog.find(raceId)
                .map(Race::statistics)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
