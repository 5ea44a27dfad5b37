package com.bko.racebuddy.race;

import com.bko.racebuddy.race.RaceStatistics.AgeGroup;
import com.bko.racebuddy.race.RaceStatistics.FinishTimes;
import com.bko.racebuddy.race.RaceStatistics.Participation;
import com.bko.racebuddy.race.RaceTips.Tip;
import com.bko.racebuddy.race.RaceTips.WeatherAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The 30 km cross-country race on Lidingö.
 */
final class Lidingoloppet {

    private Lidingoloppet() {
    }

    static Race race() {
        return new Race(
                RaceCatalog.LIDINGO,
                "Lidingöloppet",
                30.0,
                "Lidingö, Stockholm",
                "One of Sweden's most traditional cross-country races. 30 km through forest, rock"
                        + " and open fields with roughly 400 m of climbing, demanding both endurance"
                        + " and technical skill.",
                400,
                "Autumn weather, 5-15°C, risk of rain and wet ground",
                List.of(
                        "Technical rocky sections around km 8-12",
                        "Long climb near km 15",
                        "Slippery ground in rain",
                        "Dense forest with rooty trails",
                        "Mentally demanding distance"
                ),
                tips(),
                statistics());
    }

    private static RaceTips tips() {
        return new RaceTips(
                List.of(
                        new Tip("Technical training",
                                "Train regularly on technical terrain with roots and rocks",
                                "The course has many technical sections that take practice"),
                        new Tip("Hill training",
                                "Include long, steady uphill efforts in your training",
                                "Several longer climbs call for good hill strength"),
                        new Tip("Long runs",
                                "Build up to runs of 2-2.5 hours to handle the distance",
                                "30 km takes solid base endurance and mental strength")
                ),
                List.of(
                        new Tip("Equipment",
                                "Wear trail shoes with good grip, even if it is dry",
                                "The rock slabs can be slippery without rain"),
                        new Tip("Tactics",
                                "Hold back for the first 10 km and save energy for the finish",
                                "Many runners start too fast and struggle later in the race"),
                        new Tip("Nutrition",
                                "Carry fuel for at least 2.5 hours, even if you aim to be faster",
                                "Technical terrain can make you slower than planned")
                ),
                List.of(
                        new WeatherAdvice("Rain", "Take extra care on rock, shorten your stride on technical parts"),
                        new WeatherAdvice("Cold", "Dress in layers, you will warm up during the race"),
                        new WeatherAdvice("Wind", "A wind layer may be needed on open stretches, especially at Långängen")
                ));
    }

    private static RaceStatistics statistics() {
        Map<String, FinishTimes> finishTimes = new LinkedHashMap<>();
        finishTimes.put("men", new FinishTimes("2:45:30", "2:42:15", "2:28:00", "3:05:00"));
        finishTimes.put("women", new FinishTimes("3:15:20", "3:12:45", "2:55:00", "3:38:00"));

        Map<String, AgeGroup> ageGroups = new LinkedHashMap<>();
        ageGroups.put("20-29", new AgeGroup("2:35:00", 2500));
        ageGroups.put("30-39", new AgeGroup("2:42:00", 4200));
        ageGroups.put("40-49", new AgeGroup("2:55:00", 4800));
        ageGroups.put("50-59", new AgeGroup("3:12:00", 2800));
        ageGroups.put("60+", new AgeGroup("3:45:00", 700));

        Map<String, String> splits = new LinkedHashMap<>();
        splits.put("10km", "52:30");
        splits.put("20km", "1:48:20");
        splits.put("25km", "2:18:45");
        splits.put("finish", "2:55:00");

        return new RaceStatistics(new Participation(15000, 0.92, "stable"), finishTimes, ageGroups, splits);
    }
}
