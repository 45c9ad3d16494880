package app.lexis.core.review.controller;

import app.lexis.core.review.controller.dto.StudyPreferencesDto;
import app.lexis.core.review.service.StudyPreferencesService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/study/preferences")
public class StudyPreferencesController {

    private final StudyPreferencesService preferencesService;

    public StudyPreferencesController(StudyPreferencesService preferencesService) {
        this.preferencesService = preferencesService;
    }

    @GetMapping
    public StudyPreferencesDto get() {
        return preferencesService.getPreferences();
    }

    @PutMapping
    public StudyPreferencesDto update(@Valid @RequestBody StudyPreferencesDto req) {
        return preferencesService.setDailyLimit(req.dailyLimit());
    }
}
