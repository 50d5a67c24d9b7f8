package se.artisan_be.repository;

import org.springframework.stereotype.Repository;
import se.artisan_be.dto.request.ArtisanDetailsRequest;
import se.artisan_be.dto.request.LoanRequest;
import se.artisan_be.dto.request.MachineRequest;
import se.artisan_be.dto.request.TrainingRequest;
import se.artisan_be.repository.filter.FilterQueryBuilder;
import se.artisan_be.repository.jdbc.SqlClient;

import java.sql.Date;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The artisan aggregate: the artisan row plus its trainings, loans, machines and image rows.
 * Written with plain SQL so child batches and the update transaction stay explicit.
 */
@Repository
public class ArtisanRepository {

    public static final String PRODUCT_IMAGES_TABLE = "product_images";
    public static final String SHOP_IMAGES_TABLE = "shop_images";

    private static final String ARTISAN_COLUMNS = """
            name, father_name, cnic, gender, date_of_birth, contact_no, email, address,
            tehsil_id, education_level_id, dependents_count, profile_picture, ntn, skill_id,
            major_product, experience, avg_monthly_income, employment_type_id, raw_material,
            loan_status, has_machinery, has_training, inherited_skills, financial_assistance,
            technical_assistance, comments, latitude, longitude, user_id""";

    private static final String INSERT_ARTISAN = "INSERT INTO artisans (" + ARTISAN_COLUMNS + ")"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_ARTISAN = """
            UPDATE artisans SET
                name = ?, father_name = ?, cnic = ?, gender = ?, date_of_birth = ?, contact_no = ?, email = ?,
                address = ?, tehsil_id = ?, education_level_id = ?, dependents_count = ?, profile_picture = ?,
                ntn = ?, skill_id = ?, major_product = ?, experience = ?, avg_monthly_income = ?,
                employment_type_id = ?, raw_material = ?, loan_status = ?, has_machinery = ?, has_training = ?,
                inherited_skills = ?, financial_assistance = ?, technical_assistance = ?, comments = ?,
                latitude = ?, longitude = ?, user_id = ?, updated_at = CURRENT_TIMESTAMP
            WHERE id = ? AND is_active = TRUE""";

    private static final String DETAIL_QUERY = """
            SELECT a.*,
                   tr.id AS training_id, tr.title AS training_title, tr.duration AS training_duration,
                   tr.organization AS training_organization,
                   l.id AS loan_id, l.amount AS loan_amount, l.loan_date AS loan_date,
                   l.loan_type AS loan_type, l.lender_name AS loan_lender_name,
                   m.id AS machine_id, m.title AS machine_title, m.size AS machine_size,
                   m.number_of_machines AS machine_count,
                   pimg.id AS product_image_id, pimg.image_path AS product_image_path,
                   simg.id AS shop_image_id, simg.image_path AS shop_image_path
            FROM artisans_view a
            LEFT JOIN trainings tr ON tr.artisan_id = a.id
            LEFT JOIN loans l ON l.artisan_id = a.id
            LEFT JOIN machines m ON m.artisan_id = a.id
            LEFT JOIN product_images pimg ON pimg.artisan_id = a.id
            LEFT JOIN shop_images simg ON simg.artisan_id = a.id
            WHERE a.id = ?""";

    private final SqlClient sqlClient;

    public ArtisanRepository(SqlClient sqlClient) {
        this.sqlClient = sqlClient;
    }

    public Long insertArtisan(ArtisanDetailsRequest artisan, String profilePicture) {
        return sqlClient.execute(INSERT_ARTISAN, artisanParams(artisan, profilePicture).toArray()).getInsertedId();
    }

    public int updateArtisan(Long id, ArtisanDetailsRequest artisan, String profilePicture) {
        List<Object> params = artisanParams(artisan, profilePicture);
        params.add(id);
        return sqlClient.execute(UPDATE_ARTISAN, params.toArray()).getRowsAffected();
    }

    public int touch(Long id) {
        return sqlClient.execute(
                "UPDATE artisans SET updated_at = CURRENT_TIMESTAMP WHERE id = ? AND is_active = TRUE", id)
                .getRowsAffected();
    }

    public int softDelete(Long id) {
        return sqlClient.execute(
                "UPDATE artisans SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND is_active = TRUE", id)
                .getRowsAffected();
    }

    public List<Map<String, Object>> findActive(Map<String, String> filters) {
        StringBuilder sql = new StringBuilder("SELECT a.* FROM artisans_view a WHERE a.is_active = TRUE");
        List<Object> params = new ArrayList<>();
        FilterQueryBuilder.applyFilters(sql, params, "a", filters);
        sql.append(" ORDER BY a.id");
        return sqlClient.queryAll(sql.toString(), params.toArray());
    }

    public Optional<Map<String, Object>> findRow(Long id) {
        return sqlClient.queryOne("SELECT a.* FROM artisans_view a WHERE a.id = ?", id);
    }

    /** Flattened join of the artisan and all of its children; one row per child combination. */
    public List<Map<String, Object>> findDetailRows(Long id, boolean includeInactive) {
        String sql = includeInactive ? DETAIL_QUERY : DETAIL_QUERY + " AND a.is_active = TRUE";
        return sqlClient.queryAll(sql + " ORDER BY tr.id, l.id, m.id, pimg.id, simg.id", id);
    }

    public void insertTrainings(Long artisanId, List<TrainingRequest> trainings, Long userId) {
        List<Supplier<?>> inserts = new ArrayList<>();
        for (TrainingRequest training : trainings) {
            inserts.add(() -> sqlClient.execute(
                    "INSERT INTO trainings (artisan_id, title, duration, organization, user_id) VALUES (?, ?, ?, ?, ?)",
                    artisanId, training.getTitle(), training.getDuration(), training.getOrganization(), userId));
        }
        runBatch(inserts);
    }

    public void insertLoans(Long artisanId, List<LoanRequest> loans, Long userId) {
        List<Supplier<?>> inserts = new ArrayList<>();
        for (LoanRequest loan : loans) {
            inserts.add(() -> sqlClient.execute(
                    "INSERT INTO loans (artisan_id, amount, loan_date, loan_type, lender_name, user_id) VALUES (?, ?, ?, ?, ?, ?)",
                    artisanId, loan.getAmount(), loan.getDate() == null ? null : Date.valueOf(loan.getDate()),
                    loan.getLoanType(), loan.getLenderName(), userId));
        }
        runBatch(inserts);
    }

    public void insertMachines(Long artisanId, List<MachineRequest> machines, Long userId) {
        List<Supplier<?>> inserts = new ArrayList<>();
        for (MachineRequest machine : machines) {
            inserts.add(() -> sqlClient.execute(
                    "INSERT INTO machines (artisan_id, title, size, number_of_machines, user_id) VALUES (?, ?, ?, ?, ?)",
                    artisanId, machine.getTitle(), machine.getSize(), machine.getNumberOfMachines(), userId));
        }
        runBatch(inserts);
    }

    public void insertImages(String table, Long artisanId, List<String> imagePaths) {
        String sql = "INSERT INTO " + imageTable(table) + " (artisan_id, image_path) VALUES (?, ?)";
        List<Supplier<?>> inserts = new ArrayList<>();
        for (String path : imagePaths) {
            inserts.add(() -> sqlClient.execute(sql, artisanId, path));
        }
        runBatch(inserts);
    }

    public int deleteTrainings(Long artisanId) {
        return sqlClient.execute("DELETE FROM trainings WHERE artisan_id = ?", artisanId).getRowsAffected();
    }

    public int deleteLoans(Long artisanId) {
        return sqlClient.execute("DELETE FROM loans WHERE artisan_id = ?", artisanId).getRowsAffected();
    }

    public int deleteMachines(Long artisanId) {
        return sqlClient.execute("DELETE FROM machines WHERE artisan_id = ?", artisanId).getRowsAffected();
    }

    // each child batch commits or rolls back on its own; joins an enclosing transaction when there is one
    private void runBatch(List<Supplier<?>> inserts) {
        if (!inserts.isEmpty()) {
            sqlClient.inTransaction(inserts);
        }
    }

    private static String imageTable(String table) {
        if (!PRODUCT_IMAGES_TABLE.equals(table) && !SHOP_IMAGES_TABLE.equals(table)) {
            throw new IllegalArgumentException("Unknown image table: " + table);
        }
        return table;
    }

    private static List<Object> artisanParams(ArtisanDetailsRequest a, String profilePicture) {
        List<Object> params = new ArrayList<>(30);
        params.add(a.getName());
        params.add(a.getFatherName());
        params.add(a.getCnic());
        params.add(a.getGender());
        params.add(a.getDateOfBirth() == null ? null : Date.valueOf(a.getDateOfBirth()));
        params.add(a.getContactNo());
        params.add(a.getEmail());
        params.add(a.getAddress());
        params.add(a.getTehsilId());
        params.add(a.getEducationLevelId());
        params.add(a.getDependentsCount());
        params.add(profilePicture != null ? profilePicture : a.getProfilePicture());
        params.add(a.getNtn());
        params.add(a.getSkillId());
        params.add(a.getMajorProduct());
        params.add(a.getExperience());
        params.add(a.getAvgMonthlyIncome());
        params.add(a.getEmploymentTypeId());
        params.add(a.getRawMaterial());
        params.add(a.getLoanStatus());
        params.add(a.getHasMachinery());
        params.add(a.getHasTraining());
        params.add(a.getInheritedSkills());
        params.add(a.getFinancialAssistance());
        params.add(a.getTechnicalAssistance());
        params.add(a.getComments());
        params.add(a.getLatitude());
        params.add(a.getLongitude());
        params.add(a.getUserId());
        return params;
    }
}
