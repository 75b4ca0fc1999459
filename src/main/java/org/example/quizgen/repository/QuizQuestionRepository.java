package org.example.quizgen.repository;

import org.example.quizgen.entity.QuizQuestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuizQuestionRepository extends JpaRepository<QuizQuestionEntity, String> {

    List<QuizQuestionEntity> findByQuizIdOrderByPositionAsc(String quizId);

    long countByQuizId(String quizId);
}
